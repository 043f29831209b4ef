package com.jdc.pantry_service.domain.dto.inventory;

import com.jdc.pantry_service.domain.type.UsageAction;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Getter
@NoArgsConstructor @AllArgsConstructor @Builder
public class UsageLogDto {
    private Long id;
    private Long inventoryItemId;
    private Long recipeId;
    private UsageAction action;
    private BigDecimal quantityUsed;
    private String unit;
    private String notes;
    private LocalDateTime usedAt;
}
