package com.jdc.pantry_service.domain.dto.inventory;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.jdc.pantry_service.domain.dto.ingredient.IngredientSummaryDto;
import com.jdc.pantry_service.domain.type.InventoryStatus;
import com.jdc.pantry_service.domain.type.StorageLocation;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Getter @Setter
@NoArgsConstructor @AllArgsConstructor @Builder
public class InventoryItemResponseDto {
    private Long id;
    private Long userId;
    private IngredientSummaryDto ingredient;
    private StorageLocation storageLocation;
    private InventoryStatus status;
    private BigDecimal quantity;
    private String unit;
    private LocalDateTime acquisitionDate;
    private LocalDateTime expiryDate;
    private BigDecimal cost;
    private String notes;
    @JsonFormat(
            shape = JsonFormat.Shape.STRING,
            pattern = "yyyy-MM-dd'T'HH:mm:ss"
    )
    private LocalDateTime createdAt;
}
