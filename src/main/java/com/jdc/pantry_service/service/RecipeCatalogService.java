package com.jdc.pantry_service.service;

import com.jdc.pantry_service.domain.dto.ingredient.IngredientSummaryDto;
import com.jdc.pantry_service.domain.dto.recipe.RecipeRequirementsDto;
import com.jdc.pantry_service.domain.entity.Ingredient;
import com.jdc.pantry_service.domain.entity.Recipe;
import com.jdc.pantry_service.domain.entity.RecipeIngredient;
import com.jdc.pantry_service.domain.repository.IngredientRepository;
import com.jdc.pantry_service.domain.repository.RecipeRepository;
import com.jdc.pantry_service.exception.CustomException;
import com.jdc.pantry_service.exception.ErrorCode;
import com.jdc.pantry_service.mapper.InventoryItemMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * 재료/레시피 카탈로그 읽기 전용 조회.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class RecipeCatalogService {

    private final IngredientRepository ingredientRepository;
    private final RecipeRepository recipeRepository;

    public IngredientSummaryDto getIngredient(Long ingredientId) {
        Ingredient ing = ingredientRepository.findById(ingredientId)
                .orElseThrow(() -> new CustomException(ErrorCode.INGREDIENT_NOT_FOUND));
        return InventoryItemMapper.toSummary(ing);
    }

    /**
     * 사용자에게 보이는 레시피(공개 또는 본인 소유, 삭제 제외)와 재료 요구사항.
     * containingAny 가 주어지면 그 중 하나 이상을 재료로 쓰는 레시피만 조회한다.
     */
    public List<RecipeRequirementsDto> listVisibleRecipesWithRequirements(Long userId, Collection<Long> containingAny) {
        List<Recipe> recipes = (containingAny == null)
                ? recipeRepository.findVisibleWithIngredients(userId)
                : recipeRepository.findVisibleWithIngredientsContainingAny(userId, containingAny);

        return recipes.stream()
                .filter(recipe -> recipe.isVisibleTo(userId))
                .map(this::toRequirements)
                .toList();
    }

    private RecipeRequirementsDto toRequirements(Recipe recipe) {
        List<RecipeRequirementsDto.Requirement> requirements = new ArrayList<>();
        for (RecipeIngredient ri : recipe.getIngredients()) {
            Ingredient ing = ri.getIngredient();
            if (ing == null) continue;
            requirements.add(new RecipeRequirementsDto.Requirement(
                    ing.getId(), ing.getName(), ri.getQuantity(), ri.getUnit()));
        }
        return new RecipeRequirementsDto(recipe.getId(), recipe.getTitle(), requirements);
    }
}
