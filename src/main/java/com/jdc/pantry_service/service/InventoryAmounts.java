package com.jdc.pantry_service.service;

import com.jdc.pantry_service.exception.CustomException;
import com.jdc.pantry_service.exception.ErrorCode;

import java.math.BigDecimal;

/**
 * 수량/비용/무게 입력 검증. 컬럼 정밀도(수량·무게 10,3 / 비용 10,2)를 넘는 값은 저장 전에 거절한다.
 */
final class InventoryAmounts {

    static final int INTEGER_DIGITS = 7;
    static final int QUANTITY_FRACTION = 3;
    static final int COST_FRACTION = 2;

    private InventoryAmounts() {
    }

    /** 0 이상이고 정밀도 안에 들어오는 수량 */
    static void requireQuantity(BigDecimal quantity) {
        if (quantity == null || quantity.signum() < 0 || !fits(quantity, QUANTITY_FRACTION)) {
            throw new CustomException(ErrorCode.INVALID_INGREDIENT_QUANTITY);
        }
    }

    /** 0보다 크고 정밀도 안에 들어오는 사용 수량 */
    static void requirePositiveQuantity(BigDecimal quantity) {
        if (quantity == null || quantity.signum() <= 0 || !fits(quantity, QUANTITY_FRACTION)) {
            throw new CustomException(ErrorCode.INVALID_INGREDIENT_QUANTITY);
        }
    }

    static void checkCost(BigDecimal cost) {
        checkOptional(cost, COST_FRACTION, "cost");
    }

    static void checkWeight(BigDecimal weight) {
        checkOptional(weight, QUANTITY_FRACTION, "weight");
    }

    static boolean fits(BigDecimal value, int fractionDigits) {
        BigDecimal n = value.stripTrailingZeros();
        int scale = Math.max(n.scale(), 0);
        int integerDigits = n.precision() - n.scale();
        return scale <= fractionDigits && integerDigits <= INTEGER_DIGITS;
    }

    private static void checkOptional(BigDecimal value, int fractionDigits, String field) {
        if (value == null) {
            return;
        }
        if (value.signum() < 0) {
            throw new CustomException(ErrorCode.INVALID_INPUT_VALUE, field + " must be >= 0");
        }
        if (!fits(value, fractionDigits)) {
            throw new CustomException(ErrorCode.INVALID_INPUT_VALUE,
                    field + " must have at most " + INTEGER_DIGITS + " integer and " + fractionDigits + " fraction digits");
        }
    }
}
