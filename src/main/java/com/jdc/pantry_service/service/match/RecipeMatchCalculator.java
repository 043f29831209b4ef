package com.jdc.pantry_service.service.match;

import com.jdc.pantry_service.domain.dto.recipe.RecipeMatchCondition;
import com.jdc.pantry_service.domain.dto.recipe.RecipeMatchDto;
import com.jdc.pantry_service.domain.dto.recipe.RecipeRequirementsDto;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 보유 재료 집합과 레시피 재료 요구사항으로 일치율을 계산하고 정렬한다. DB 접근 없음.
 *
 * <p>정렬 기준: 일치율 내림차순 → 재료 수 오름차순 → 레시피 id 오름차순.
 * prioritizeExpiring 이면 임박 재료 사용 레시피를 가장 먼저 둔다.</p>
 */
@Component
public class RecipeMatchCalculator {

    static final Comparator<RecipeMatchDto> BY_MATCH =
            Comparator.comparingInt(RecipeMatchDto::getMatchPercentage).reversed()
                    .thenComparingInt(RecipeMatchDto::getTotalIngredients)
                    .thenComparing(RecipeMatchDto::getRecipeId, Comparator.nullsLast(Comparator.<Long>naturalOrder()));

    static final Comparator<RecipeMatchDto> EXPIRING_FIRST =
            Comparator.comparing((RecipeMatchDto m) -> Boolean.TRUE.equals(m.getUsesExpiring()), Comparator.reverseOrder())
                    .thenComparing(BY_MATCH);

    public List<RecipeMatchDto> rank(List<RecipeRequirementsDto> recipes,
                                     AvailableIngredients available,
                                     RecipeMatchCondition condition) {
        if (available.isEmpty()) {
            return List.of();
        }

        Comparator<RecipeMatchDto> order = condition.isPrioritizeExpiring() ? EXPIRING_FIRST : BY_MATCH;

        return recipes.stream()
                .map(recipe -> score(recipe, available, condition.isPrioritizeExpiring()))
                .flatMap(Optional::stream)
                .filter(match -> match.getMatchPercentage() >= condition.getMinMatchPercentage())
                .sorted(order)
                .limit(condition.getLimit())
                .toList();
    }

    /** 재료 요구사항이 없는 레시피는 빈 값. 같은 재료가 여러 번 적혀 있으면 처음 것만 센다. */
    public Optional<RecipeMatchDto> score(RecipeRequirementsDto recipe,
                                          AvailableIngredients available,
                                          boolean markExpiring) {
        Map<Long, RecipeRequirementsDto.Requirement> distinct = new LinkedHashMap<>();
        for (RecipeRequirementsDto.Requirement req : recipe.requirements()) {
            if (req.ingredientId() == null) continue;
            distinct.putIfAbsent(req.ingredientId(), req);
        }

        int total = distinct.size();
        if (total == 0) {
            return Optional.empty();
        }

        int matched = 0;
        boolean usesExpiring = false;
        List<RecipeMatchDto.MissingIngredientDto> missing = new ArrayList<>();

        for (RecipeRequirementsDto.Requirement req : distinct.values()) {
            if (available.contains(req.ingredientId())) {
                matched++;
                if (available.isNearExpiry(req.ingredientId())) {
                    usesExpiring = true;
                }
            } else {
                missing.add(new RecipeMatchDto.MissingIngredientDto(
                        req.ingredientId(), req.name(), req.amount(), req.unit()));
            }
        }

        return Optional.of(RecipeMatchDto.builder()
                .recipeId(recipe.recipeId())
                .title(recipe.title())
                .totalIngredients(total)
                .matchedIngredients(matched)
                .matchPercentage(percentage(matched, total))
                .usesExpiring(markExpiring ? usesExpiring : null)
                .missingIngredients(missing)
                .build());
    }

    /** matched / total * 100, 정수 반올림(HALF_UP) */
    static int percentage(int matched, int total) {
        return BigDecimal.valueOf(matched * 100L)
                .divide(BigDecimal.valueOf(total), 0, RoundingMode.HALF_UP)
                .intValue();
    }
}
