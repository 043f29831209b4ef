package com.jdc.pantry_service.domain.dto.waste;

import com.jdc.pantry_service.domain.type.WasteOutcome;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import lombok.*;

import java.math.BigDecimal;

@Getter @Setter
@NoArgsConstructor @AllArgsConstructor @Builder
public class WasteRequestDto {

    @NotNull
    @Schema(description = "처리 방식 (thrown_out, composted, fed_to_animals, other)", example = "composted")
    private WasteOutcome outcome;

    @Size(max = 1000)
    private String notes;

    @PositiveOrZero
    @Schema(description = "폐기 비용. 없으면 아이템에 기록된 구매 비용을 사용")
    @Digits(integer = 7, fraction = 2)
    private BigDecimal cost;

    @PositiveOrZero
    @Digits(integer = 7, fraction = 3)
    private BigDecimal weight;
}
