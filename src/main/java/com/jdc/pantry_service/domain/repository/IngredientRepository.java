package com.jdc.pantry_service.domain.repository;

import com.jdc.pantry_service.domain.entity.Ingredient;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface IngredientRepository extends JpaRepository<Ingredient, Long> {

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Ingredient i SET i.usageCount = i.usageCount + 1 WHERE i.id = :id")
    int incrementUsageCount(@Param("id") Long id);
}
