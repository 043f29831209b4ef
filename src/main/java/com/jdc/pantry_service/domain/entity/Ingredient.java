package com.jdc.pantry_service.domain.entity;

import jakarta.persistence.*;
import lombok.*;

/**
 * 재료 카탈로그. 재고 모듈은 이름/카테고리를 읽고 사용 횟수만 갱신한다.
 */
@Entity
@Table(name = "ingredients", uniqueConstraints = {
        @UniqueConstraint(columnNames = {"name"})
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class Ingredient {

    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 100)
    private String name;

    @Column(length = 50)
    private String category;

    @Column(name = "usage_count", nullable = false)
    @Builder.Default
    private Long usageCount = 0L;
}
