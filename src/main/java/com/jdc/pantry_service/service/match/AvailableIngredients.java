package com.jdc.pantry_service.service.match;

import com.jdc.pantry_service.domain.entity.InventoryItem;
import com.jdc.pantry_service.domain.type.InventoryStatus;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

/**
 * 매칭에 쓰이는 보유 재료 집합.
 *
 * @param ingredientIds         FRESH / USE_SOON / EXPIRING 아이템의 재료 id
 * @param nearExpiryIngredientIds 그 중 USE_SOON / EXPIRING 아이템의 재료 id
 */
public record AvailableIngredients(Set<Long> ingredientIds, Set<Long> nearExpiryIngredientIds) {

    public AvailableIngredients {
        ingredientIds = Set.copyOf(ingredientIds);
        nearExpiryIngredientIds = Set.copyOf(nearExpiryIngredientIds);
    }

    public static AvailableIngredients from(Collection<InventoryItem> items) {
        Set<Long> available = new HashSet<>();
        Set<Long> nearExpiry = new HashSet<>();
        for (InventoryItem item : items) {
            if (!item.isAvailable()) continue;
            Long ingredientId = item.getIngredient().getId();
            available.add(ingredientId);
            if (InventoryStatus.NEAR_EXPIRY.contains(item.getStatus())) {
                nearExpiry.add(ingredientId);
            }
        }
        return new AvailableIngredients(available, nearExpiry);
    }

    public boolean isEmpty() {
        return ingredientIds.isEmpty();
    }

    public boolean contains(Long ingredientId) {
        return ingredientIds.contains(ingredientId);
    }

    public boolean isNearExpiry(Long ingredientId) {
        return nearExpiryIngredientIds.contains(ingredientId);
    }
}
