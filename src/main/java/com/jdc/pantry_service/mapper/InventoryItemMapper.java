package com.jdc.pantry_service.mapper;

import com.jdc.pantry_service.domain.dto.ingredient.IngredientSummaryDto;
import com.jdc.pantry_service.domain.dto.inventory.InventoryItemResponseDto;
import com.jdc.pantry_service.domain.dto.inventory.UsageLogDto;
import com.jdc.pantry_service.domain.entity.Ingredient;
import com.jdc.pantry_service.domain.entity.InventoryItem;
import com.jdc.pantry_service.domain.entity.InventoryUsageLog;

public class InventoryItemMapper {

    public static InventoryItemResponseDto toDto(InventoryItem item) {
        return InventoryItemResponseDto.builder()
                .id(item.getId())
                .userId(item.getUserId())
                .ingredient(toSummary(item.getIngredient()))
                .storageLocation(item.getStorageLocation())
                .status(item.getStatus())
                .quantity(item.getQuantity())
                .unit(item.getUnit())
                .acquisitionDate(item.getAcquisitionDate())
                .expiryDate(item.getExpiryDate())
                .cost(item.getCost())
                .notes(item.getNotes())
                .createdAt(item.getCreatedAt())
                .build();
    }

    public static IngredientSummaryDto toSummary(Ingredient ingredient) {
        if (ingredient == null) return null;
        return new IngredientSummaryDto(ingredient.getId(), ingredient.getName(), ingredient.getCategory());
    }

    public static UsageLogDto toUsageLogDto(InventoryUsageLog log) {
        return UsageLogDto.builder()
                .id(log.getId())
                .inventoryItemId(log.getInventoryItemId())
                .recipeId(log.getRecipeId())
                .action(log.getAction())
                .quantityUsed(log.getQuantityUsed())
                .unit(log.getUnit())
                .notes(log.getNotes())
                .usedAt(log.getUsedAt())
                .build();
    }
}
