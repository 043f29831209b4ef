package com.jdc.pantry_service.domain.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(
        name = "recipes",
        indexes = {
                @Index(name = "idx_user_id", columnList = "user_id")
        }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class Recipe {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(length = 50, nullable = false)
    private String title;

    @Column(nullable = false)
    @Builder.Default
    private Boolean isPrivate = false;

    @Column(name = "cook_count", nullable = false)
    @Builder.Default
    private Long cookCount = 0L;

    @Column(name = "deleted_at")
    private LocalDateTime deletedAt;

    @OneToMany(mappedBy = "recipe", fetch = FetchType.LAZY)
    @OrderBy("position ASC")
    @Builder.Default
    private List<RecipeIngredient> ingredients = new ArrayList<>();

    public boolean isDeleted() {
        return deletedAt != null;
    }

    public boolean isVisibleTo(Long userId) {
        return !isDeleted() && (!Boolean.TRUE.equals(isPrivate) || this.userId.equals(userId));
    }
}
