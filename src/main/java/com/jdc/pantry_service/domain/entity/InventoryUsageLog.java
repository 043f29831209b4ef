package com.jdc.pantry_service.domain.entity;

import com.jdc.pantry_service.domain.type.UsageAction;
import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Entity
@Table(
        name = "inventory_usage_logs",
        indexes = {
                @Index(name = "idx_usage_item", columnList = "inventory_item_id, used_at")
        }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class InventoryUsageLog {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    // 아이템이 삭제되어도 사용 기록은 남는다.
    @Column(name = "inventory_item_id", nullable = false, updatable = false)
    private Long inventoryItemId;

    @Column(name = "recipe_id", updatable = false)
    private Long recipeId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20, updatable = false)
    private UsageAction action;

    @Column(name = "quantity_used", nullable = false, precision = 10, scale = 3, updatable = false)
    private BigDecimal quantityUsed;

    @Column(nullable = false, length = 50, updatable = false)
    private String unit;

    @Column(length = 500, updatable = false)
    private String notes;

    @Column(name = "used_at", nullable = false, updatable = false)
    private LocalDateTime usedAt;
}
