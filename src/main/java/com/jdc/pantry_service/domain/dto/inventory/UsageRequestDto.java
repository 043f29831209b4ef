package com.jdc.pantry_service.domain.dto.inventory;

import com.jdc.pantry_service.domain.type.UsageAction;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.*;

import java.math.BigDecimal;

@Getter @Setter
@NoArgsConstructor @AllArgsConstructor @Builder
public class UsageRequestDto {

    @NotNull
    @Positive(message = "사용 수량은 0보다 커야 합니다.")
    @Digits(integer = 7, fraction = 3, message = "수량은 정수 7자리, 소수 3자리까지 입력할 수 있습니다.")
    private BigDecimal quantity;

    @Builder.Default
    private UsageAction action = UsageAction.COOKED;

    private Long recipeId;

    @Size(max = 500)
    private String notes;
}
