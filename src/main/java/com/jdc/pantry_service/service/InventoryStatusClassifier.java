package com.jdc.pantry_service.service;

import com.jdc.pantry_service.domain.entity.InventoryItem;
import com.jdc.pantry_service.domain.type.InventoryStatus;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * 유통기한과 현재 시각으로 신선도 상태를 판정한다.
 * <ul>
 *     <li>유통기한 없음 → FRESH</li>
 *     <li>남은 일수 &lt; 0 → EXPIRED</li>
 *     <li>0 ~ 1일 → EXPIRING</li>
 *     <li>2 ~ 3일 → USE_SOON</li>
 *     <li>4일 이상 → FRESH</li>
 * </ul>
 * 남은 일수는 (유통기한 - 현재) 를 일 단위로 내림한 값이다. USED / WASTED 는 반환하지 않는다.
 */
@Component
public class InventoryStatusClassifier {

    private static final long MILLIS_PER_DAY = Duration.ofDays(1).toMillis();

    public InventoryStatus classify(LocalDateTime expiryDate, LocalDateTime now) {
        if (expiryDate == null) {
            return InventoryStatus.FRESH;
        }

        long daysUntilExpiry = floorDays(now, expiryDate);

        if (daysUntilExpiry < 0) {
            return InventoryStatus.EXPIRED;
        } else if (daysUntilExpiry <= 1) {
            return InventoryStatus.EXPIRING;
        } else if (daysUntilExpiry <= 3) {
            return InventoryStatus.USE_SOON;
        }
        return InventoryStatus.FRESH;
    }

    /** 아이템 상태를 다시 계산해 반영하고, 변경 여부를 돌려준다. */
    public boolean refresh(InventoryItem item, LocalDateTime now) {
        if (item.isTerminal()) {
            return false;
        }
        return item.refreshStatus(classify(item.getExpiryDate(), now));
    }

    /** from → to 경과 일수 (내림). 음수가 될 수 있다. */
    public long floorDays(LocalDateTime from, LocalDateTime to) {
        return Math.floorDiv(Duration.between(from, to).toMillis(), MILLIS_PER_DAY);
    }
}
