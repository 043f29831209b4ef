package com.jdc.pantry_service.service;

import com.jdc.pantry_service.domain.dto.inventory.UsageLogDto;
import com.jdc.pantry_service.domain.dto.inventory.UsageRequestDto;
import com.jdc.pantry_service.domain.dto.inventory.UsageResultDto;
import com.jdc.pantry_service.domain.entity.InventoryItem;
import com.jdc.pantry_service.domain.entity.InventoryUsageLog;
import com.jdc.pantry_service.domain.repository.IngredientRepository;
import com.jdc.pantry_service.domain.repository.InventoryItemRepository;
import com.jdc.pantry_service.domain.repository.InventoryUsageLogRepository;
import com.jdc.pantry_service.domain.repository.RecipeRepository;
import com.jdc.pantry_service.domain.type.UsageAction;
import com.jdc.pantry_service.exception.CustomException;
import com.jdc.pantry_service.exception.ErrorCode;
import com.jdc.pantry_service.mapper.InventoryItemMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 재고 사용 처리.
 * 아이템 잠금 → 사용 기록 → 수량 차감 → 사용 횟수 집계까지 하나의 트랜잭션으로 묶는다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InventoryUsageService {

    private final InventoryItemRepository itemRepository;
    private final InventoryUsageLogRepository usageLogRepository;
    private final IngredientRepository ingredientRepository;
    private final RecipeRepository recipeRepository;
    private final Clock clock;

    @Transactional
    public UsageResultDto markAsUsed(Long itemId, UsageRequestDto dto) {
        BigDecimal quantityUsed = dto.getQuantity();
        InventoryAmounts.requirePositiveQuantity(quantityUsed);
        UsageAction action = dto.getAction() != null ? dto.getAction() : UsageAction.COOKED;

        InventoryItem item = itemRepository.findByIdForUpdate(itemId)
                .orElseThrow(() -> new CustomException(ErrorCode.INVENTORY_ITEM_NOT_FOUND));

        if (item.isTerminal()) {
            throw new CustomException(ErrorCode.ITEM_ALREADY_TERMINAL);
        }

        BigDecimal current = item.getQuantity();
        if (quantityUsed.compareTo(current) > 0) {
            log.warn("[Inventory] over-use rejected: item={}, requested={}, available={} {}",
                    itemId, quantityUsed, current, item.getUnit());
            throw new CustomException(ErrorCode.INSUFFICIENT_INVENTORY_QUANTITY,
                    String.format("Cannot use %s %s. Only %s %s available.",
                            quantityUsed.toPlainString(), item.getUnit(), current.toPlainString(), item.getUnit()));
        }

        if (dto.getRecipeId() != null && !recipeRepository.existsById(dto.getRecipeId())) {
            throw new CustomException(ErrorCode.RECIPE_NOT_FOUND);
        }

        usageLogRepository.save(
                InventoryUsageLog.builder()
                        .inventoryItemId(item.getId())
                        .recipeId(dto.getRecipeId())
                        .action(action)
                        .quantityUsed(quantityUsed)
                        .unit(item.getUnit())
                        .notes(dto.getNotes())
                        .usedAt(LocalDateTime.now(clock))
                        .build()
        );

        item.consume(current.subtract(quantityUsed));
        itemRepository.save(item);

        ingredientRepository.incrementUsageCount(item.getIngredient().getId());
        if (action == UsageAction.COOKED && dto.getRecipeId() != null) {
            recipeRepository.incrementCookCount(dto.getRecipeId());
        }

        if (item.isTerminal()) {
            log.info("[Inventory] item {} used up ({})", itemId, action.getCode());
        }

        return new UsageResultDto(item.getQuantity(), item.getStatus());
    }

    /** 아이템 사용 기록 (최신순) */
    @Transactional(readOnly = true)
    public List<UsageLogDto> getUsageHistory(Long itemId) {
        if (!itemRepository.existsById(itemId)) {
            throw new CustomException(ErrorCode.INVENTORY_ITEM_NOT_FOUND);
        }
        return usageLogRepository.findAllByInventoryItemIdOrderByUsedAtDescIdDesc(itemId).stream()
                .map(InventoryItemMapper::toUsageLogDto)
                .toList();
    }
}
