package com.jdc.pantry_service.domain.dto.waste;

import com.jdc.pantry_service.domain.type.WasteOutcome;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.Map;

@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class WasteSummaryDto {
    private long recordCount;
    private BigDecimal totalCost;
    private BigDecimal totalWeight;
    private double averageDaysOwned;
    private Map<WasteOutcome, Long> countByOutcome;
}
