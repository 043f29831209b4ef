package com.jdc.pantry_service.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public enum ErrorCode {

    // --- Recipe (200) ---
    RECIPE_NOT_FOUND(HttpStatus.NOT_FOUND, "201", "요청한 레시피가 존재하지 않습니다."),

    // --- Ingredient (400) ---
    INGREDIENT_NOT_FOUND(HttpStatus.NOT_FOUND, "401", "요청한 재료가 존재하지 않습니다."),
    INVALID_INGREDIENT_QUANTITY(HttpStatus.BAD_REQUEST, "402", "재료 수량이 유효하지 않습니다."),

    // --- Inventory (500) ---
    INVENTORY_UNAUTHORIZED(HttpStatus.UNAUTHORIZED, "502", "사용자 식별 정보가 필요합니다."),
    INVENTORY_ACCESS_DENIED(HttpStatus.FORBIDDEN, "503", "다른 사용자의 재고에 접근할 수 없습니다."),
    INVENTORY_ITEM_NOT_FOUND(HttpStatus.NOT_FOUND, "504", "요청한 재고 아이템이 존재하지 않습니다."),
    ITEM_ALREADY_TERMINAL(HttpStatus.CONFLICT, "505", "이미 사용 완료되었거나 폐기된 아이템입니다."),
    INSUFFICIENT_INVENTORY_QUANTITY(HttpStatus.BAD_REQUEST, "506", "보유 수량보다 많이 사용할 수 없습니다."),
    INVENTORY_CONCURRENT_MODIFICATION(HttpStatus.CONFLICT, "507", "다른 요청이 먼저 재고를 변경했습니다. 다시 시도해주세요."),

    // --- Common (900) ---
    INVALID_INPUT_VALUE(HttpStatus.BAD_REQUEST, "901", "잘못된 입력값입니다."),
    METHOD_NOT_ALLOWED(HttpStatus.METHOD_NOT_ALLOWED, "902", "허용되지 않은 메소드입니다."),
    INTERNAL_SERVER_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "903", "서버 내부 오류입니다."),
    DATA_INTEGRITY_VIOLATION(HttpStatus.CONFLICT, "905", "데이터베이스 제약조건 위반입니다."),
    INVALID_CONTENT_TYPE(HttpStatus.UNSUPPORTED_MEDIA_TYPE, "906", "지원하지 않는 Content-Type 입니다."),
    ;

    private final HttpStatus status;
    private final String code;
    private final String message;

    ErrorCode(HttpStatus status, String code, String message) {
        this.status = status;
        this.code = code;
        this.message = message;
    }
}
