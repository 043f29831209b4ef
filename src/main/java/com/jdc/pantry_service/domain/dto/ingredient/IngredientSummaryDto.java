package com.jdc.pantry_service.domain.dto.ingredient;

public record IngredientSummaryDto(
        Long    id,
        String  name,
        String  category
) { }
