package com.jdc.pantry_service.domain.entity;

import com.jdc.pantry_service.domain.type.WasteOutcome;
import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Entity
@Table(
        name = "waste_records",
        indexes = {
                @Index(name = "idx_waste_user_date", columnList = "user_id, wasted_at")
        }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class WasteRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private Long userId;

    @Column(name = "ingredient_id", nullable = false, updatable = false)
    private Long ingredientId;

    @Column(name = "inventory_item_id", updatable = false)
    private Long inventoryItemId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20, updatable = false)
    private WasteOutcome outcome;

    @Column(precision = 10, scale = 2, updatable = false)
    private BigDecimal cost;

    @Column(precision = 10, scale = 3, updatable = false)
    private BigDecimal weight;

    @Column(name = "days_owned", nullable = false, updatable = false)
    private Integer daysOwned;

    @Column(length = 1000, updatable = false)
    private String notes;

    @Column(name = "wasted_at", nullable = false, updatable = false)
    private LocalDateTime wastedAt;
}
