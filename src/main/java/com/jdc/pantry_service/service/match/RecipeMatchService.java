package com.jdc.pantry_service.service.match;

import com.jdc.pantry_service.config.InventoryProperties;
import com.jdc.pantry_service.domain.dto.recipe.RecipeMatchCondition;
import com.jdc.pantry_service.domain.dto.recipe.RecipeMatchDto;
import com.jdc.pantry_service.domain.dto.recipe.RecipeRequirementsDto;
import com.jdc.pantry_service.domain.entity.InventoryItem;
import com.jdc.pantry_service.exception.CustomException;
import com.jdc.pantry_service.exception.ErrorCode;
import com.jdc.pantry_service.service.InventoryItemService;
import com.jdc.pantry_service.service.RecipeCatalogService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * 보유 재고로 만들 수 있는 레시피 추천.
 * 1) 보유 재료 집합 조회 2) 후보 레시피 조회 3) {@link RecipeMatchCalculator} 로 점수 계산/정렬.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RecipeMatchService {

    private final InventoryItemService inventoryItemService;
    private final RecipeCatalogService recipeCatalogService;
    private final RecipeMatchCalculator calculator;
    private final InventoryProperties inventoryProperties;

    /** 읽기 전용: 조회 중 다시 계산된 상태는 응답에만 반영되고 저장되지 않는다. */
    @Transactional(readOnly = true)
    public List<RecipeMatchDto> matchRecipes(Long userId, RecipeMatchCondition condition) {
        RecipeMatchCondition cond = condition != null ? condition : defaultCondition();
        validate(cond);

        List<InventoryItem> items = inventoryItemService.findAvailableItems(userId);
        AvailableIngredients available = AvailableIngredients.from(items);

        if (available.isEmpty()) {
            return List.of();
        }

        // 일치율 0% 레시피가 걸러지는 경우, 보유 재료를 하나도 쓰지 않는 레시피는 조회할 필요가 없다.
        List<RecipeRequirementsDto> candidates = cond.getMinMatchPercentage() > 0
                ? recipeCatalogService.listVisibleRecipesWithRequirements(userId, available.ingredientIds())
                : recipeCatalogService.listVisibleRecipesWithRequirements(userId, null);

        List<RecipeMatchDto> result = calculator.rank(candidates, available, cond);
        log.debug("[Match] user={} available={} candidates={} matched={}",
                userId, available.ingredientIds().size(), candidates.size(), result.size());
        return result;
    }

    public RecipeMatchCondition defaultCondition() {
        return RecipeMatchCondition.builder()
                .minMatchPercentage(inventoryProperties.getDefaultMinMatchPercentage())
                .limit(inventoryProperties.getDefaultMatchLimit())
                .prioritizeExpiring(false)
                .build();
    }

    private void validate(RecipeMatchCondition cond) {
        if (cond.getMinMatchPercentage() < 0 || cond.getMinMatchPercentage() > 100) {
            throw new CustomException(ErrorCode.INVALID_INPUT_VALUE, "minMatchPercentage must be between 0 and 100");
        }
        if (cond.getLimit() < 1 || cond.getLimit() > inventoryProperties.getMaxMatchLimit()) {
            throw new CustomException(ErrorCode.INVALID_INPUT_VALUE,
                    "limit must be between 1 and " + inventoryProperties.getMaxMatchLimit());
        }
    }
}
