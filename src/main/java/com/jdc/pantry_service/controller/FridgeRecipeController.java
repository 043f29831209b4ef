package com.jdc.pantry_service.controller;

import com.jdc.pantry_service.domain.dto.recipe.RecipeMatchCondition;
import com.jdc.pantry_service.domain.dto.recipe.RecipeMatchDto;
import com.jdc.pantry_service.service.match.RecipeMatchService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/inventory/matches")
@RequiredArgsConstructor
@Tag(name = "재고 기반 레시피 API", description = "보유 재료로 만들 수 있는 레시피를 일치율 순으로 추천합니다.")
public class FridgeRecipeController {

    private final RecipeMatchService recipeMatchService;

    @GetMapping
    @Operation(summary = "재고 기반 레시피 추천",
            description = "minMatchPercentage 이상 일치하는 레시피를 일치율 내림차순, 재료 수 오름차순으로 반환합니다.")
    public ResponseEntity<List<RecipeMatchDto>> findByInventory(
            @Parameter(hidden = true) @RequestHeader(InventoryItemController.USER_HEADER) Long userId,
            @RequestParam(required = false) Integer minMatchPercentage,
            @RequestParam(required = false, defaultValue = "false") boolean prioritizeExpiring,
            @RequestParam(required = false) Integer limit) {

        RecipeMatchCondition defaults = recipeMatchService.defaultCondition();
        RecipeMatchCondition cond = RecipeMatchCondition.builder()
                .minMatchPercentage(minMatchPercentage != null ? minMatchPercentage : defaults.getMinMatchPercentage())
                .prioritizeExpiring(prioritizeExpiring)
                .limit(limit != null ? limit : defaults.getLimit())
                .build();

        return ResponseEntity.ok(recipeMatchService.matchRecipes(userId, cond));
    }
}
