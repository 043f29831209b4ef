package com.jdc.pantry_service.domain.dto.recipe;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RecipeMatchCondition {

    @Schema(description = "최소 일치율 (0~100)", example = "50")
    @Builder.Default
    private int minMatchPercentage = 50;

    @Schema(description = "유통기한 임박 재료를 쓰는 레시피 우선", example = "false")
    @Builder.Default
    private boolean prioritizeExpiring = false;

    @Schema(description = "최대 결과 수 (1~50)", example = "20")
    @Builder.Default
    private int limit = 20;

    public static RecipeMatchCondition defaults() {
        return RecipeMatchCondition.builder().build();
    }
}
