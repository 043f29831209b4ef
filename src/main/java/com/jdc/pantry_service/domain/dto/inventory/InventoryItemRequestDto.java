package com.jdc.pantry_service.domain.dto.inventory;

import com.jdc.pantry_service.domain.type.StorageLocation;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Getter @Setter
@NoArgsConstructor @AllArgsConstructor @Builder
public class InventoryItemRequestDto {

    @NotNull
    private Long ingredientId;

    @NotNull
    @Schema(description = "보관 위치 (fridge, freezer, pantry, counter, other)", example = "fridge")
    private StorageLocation storageLocation;

    @NotNull
    @PositiveOrZero(message = "수량은 0 이상이어야 합니다.")
    @Digits(integer = 7, fraction = 3, message = "수량은 정수 7자리, 소수 3자리까지 입력할 수 있습니다.")
    private BigDecimal quantity;

    @NotBlank
    @Size(max = 50)
    private String unit;

    @Schema(description = "유통기한 (없으면 fresh 로 분류)")
    private LocalDateTime expiryDate;

    @PositiveOrZero
    @Digits(integer = 7, fraction = 2)
    private BigDecimal cost;

    @Size(max = 1000)
    private String notes;
}
