package com.jdc.pantry_service.domain.entity;

import com.jdc.pantry_service.domain.entity.common.BaseTimeEntity;
import com.jdc.pantry_service.domain.type.InventoryStatus;
import com.jdc.pantry_service.domain.type.StorageLocation;
import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 사용자가 보유한 재료 한 묶음(lot).
 * status 는 조회/저장 시점마다 {@link #refreshStatus(InventoryStatus)} 로 다시 계산된다.
 */
@Entity
@Table(
        name = "inventory_items",
        indexes = {
                @Index(name = "idx_inventory_user_status", columnList = "user_id, status"),
                @Index(name = "idx_inventory_user_expiry", columnList = "user_id, expiry_date")
        }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class InventoryItem extends BaseTimeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "ingredient_id", nullable = false)
    private Ingredient ingredient;

    @Enumerated(EnumType.STRING)
    @Column(name = "storage_location", nullable = false, length = 20)
    private StorageLocation storageLocation;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private InventoryStatus status = InventoryStatus.FRESH;

    @Column(nullable = false, precision = 10, scale = 3)
    private BigDecimal quantity;

    @Column(nullable = false, length = 50)
    private String unit;

    @Column(name = "acquisition_date", nullable = false)
    private LocalDateTime acquisitionDate;

    @Column(name = "expiry_date")
    private LocalDateTime expiryDate;

    @Column(precision = 10, scale = 2)
    private BigDecimal cost;

    @Column(length = 1000)
    private String notes;

    // 잠금 없이 읽은 경로(조회 시 재분류, 수정, 배치)가 사용/폐기 처리를 덮어쓰지 못하게 한다.
    @Version
    private Long version;

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public boolean isAvailable() {
        return status.isAvailable();
    }

    /** 계산된 신선도 상태를 반영한다. 종료 상태(USED, WASTED)는 바뀌지 않는다. */
    public boolean refreshStatus(InventoryStatus classified) {
        if (isTerminal() || classified == status) {
            return false;
        }
        if (classified.isTerminal()) {
            throw new IllegalArgumentException("Terminal status cannot be assigned by classification: " + classified);
        }
        this.status = classified;
        return true;
    }

    public void updateStorageLocation(StorageLocation storageLocation) {
        this.storageLocation = storageLocation;
    }

    public void updateQuantity(BigDecimal quantity) {
        this.quantity = quantity;
    }

    public void updateUnit(String unit) {
        this.unit = unit;
    }

    public void updateExpiryDate(LocalDateTime expiryDate) {
        this.expiryDate = expiryDate;
    }

    public void updateCost(BigDecimal cost) {
        this.cost = cost;
    }

    public void updateNotes(String notes) {
        this.notes = notes;
    }

    /** 남은 수량을 반영한다. 0 이하가 되면 수량 0, 상태 USED 로 종료된다. */
    public void consume(BigDecimal remaining) {
        if (remaining.signum() <= 0) {
            this.quantity = BigDecimal.ZERO;
            this.status = InventoryStatus.USED;
        } else {
            this.quantity = remaining;
        }
    }

    /** 폐기는 처리 사유일 뿐이므로 수량은 그대로 둔다. */
    public void markWasted() {
        this.status = InventoryStatus.WASTED;
    }
}
