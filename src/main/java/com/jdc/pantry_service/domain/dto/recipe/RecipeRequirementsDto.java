package com.jdc.pantry_service.domain.dto.recipe;

import java.util.List;

/**
 * 매칭 계산에 필요한 레시피 정보. 재료 요구사항은 레시피에 적힌 순서를 따른다.
 */
public record RecipeRequirementsDto(
        Long recipeId,
        String title,
        List<Requirement> requirements
) {

    public record Requirement(
            Long ingredientId,
            String name,
            String amount,
            String unit
    ) { }
}
