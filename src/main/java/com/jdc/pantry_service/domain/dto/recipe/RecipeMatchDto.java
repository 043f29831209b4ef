package com.jdc.pantry_service.domain.dto.recipe;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.*;

import java.util.List;

@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@EqualsAndHashCode
@Schema(description = "보유 재고 기반 레시피 매칭 결과")
public class RecipeMatchDto {

    private Long recipeId;
    private String title;

    @Schema(description = "레시피의 서로 다른 재료 수")
    private int totalIngredients;

    @Schema(description = "보유 중인 재료 수")
    private int matchedIngredients;

    @Schema(description = "일치율 (반올림 정수)")
    private int matchPercentage;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @Schema(description = "임박 재료 사용 여부 (prioritizeExpiring=true 일 때만)")
    private Boolean usesExpiring;

    @Schema(description = "부족한 재료 목록")
    private List<MissingIngredientDto> missingIngredients;

    @Data
    @AllArgsConstructor
    @NoArgsConstructor
    public static class MissingIngredientDto {
        private Long ingredientId;
        private String name;
        private String amount;
        private String unit;
    }
}
