package com.jdc.pantry_service.domain.type;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.jdc.pantry_service.exception.CustomException;
import com.jdc.pantry_service.exception.ErrorCode;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * 재고 아이템의 신선도/생애주기 상태.
 * FRESH ~ EXPIRED 는 유통기한으로부터 계산되고, USED / WASTED 는 사용·폐기 처리로만 설정되는 종료 상태이다.
 */
public enum InventoryStatus {
    FRESH("fresh"),
    USE_SOON("use_soon"),
    EXPIRING("expiring"),
    EXPIRED("expired"),
    USED("used"),
    WASTED("wasted");

    public static final Set<InventoryStatus> TERMINAL = Collections.unmodifiableSet(EnumSet.of(USED, WASTED));
    public static final Set<InventoryStatus> AVAILABLE = Collections.unmodifiableSet(EnumSet.of(FRESH, USE_SOON, EXPIRING));
    public static final Set<InventoryStatus> NEAR_EXPIRY = Collections.unmodifiableSet(EnumSet.of(USE_SOON, EXPIRING));

    private final String code;

    InventoryStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    public boolean isAvailable() {
        return AVAILABLE.contains(this);
    }

    @JsonCreator
    public static InventoryStatus fromCode(String code) {
        for (InventoryStatus s : values()) {
            if (s.code.equalsIgnoreCase(code) || s.name().equalsIgnoreCase(code)) {
                return s;
            }
        }
        throw new CustomException(ErrorCode.INVALID_INPUT_VALUE, "Invalid inventory status: " + code);
    }
}
