package com.jdc.pantry_service.domain.repository;

import com.jdc.pantry_service.domain.entity.Recipe;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface RecipeRepository extends JpaRepository<Recipe, Long> {

    /** 공개 레시피 + 내 레시피 (삭제 제외), 재료 목록 함께 로딩 */
    @Query("SELECT DISTINCT r FROM Recipe r " +
            "LEFT JOIN FETCH r.ingredients ri " +
            "LEFT JOIN FETCH ri.ingredient " +
            "WHERE r.deletedAt IS NULL " +
            "AND (r.isPrivate = false OR r.userId = :userId)")
    List<Recipe> findVisibleWithIngredients(@Param("userId") Long userId);

    /** 위 조건 + 주어진 재료를 하나 이상 포함하는 레시피만 */
    @Query("SELECT DISTINCT r FROM Recipe r " +
            "LEFT JOIN FETCH r.ingredients ri " +
            "LEFT JOIN FETCH ri.ingredient " +
            "WHERE r.deletedAt IS NULL " +
            "AND (r.isPrivate = false OR r.userId = :userId) " +
            "AND r.id IN (SELECT ri2.recipe.id FROM RecipeIngredient ri2 WHERE ri2.ingredient.id IN :ingredientIds)")
    List<Recipe> findVisibleWithIngredientsContainingAny(@Param("userId") Long userId,
                                                         @Param("ingredientIds") Collection<Long> ingredientIds);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Recipe r SET r.cookCount = r.cookCount + 1 WHERE r.id = :id")
    int incrementCookCount(@Param("id") Long id);
}
