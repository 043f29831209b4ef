package com.jdc.pantry_service.domain.type;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.jdc.pantry_service.exception.CustomException;
import com.jdc.pantry_service.exception.ErrorCode;

public enum UsageAction {
    COOKED("cooked"),
    SNACKED("snacked"),
    DONATED("donated"),
    OTHER("other");

    private final String code;

    UsageAction(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static UsageAction fromCode(String code) {
        for (UsageAction a : values()) {
            if (a.code.equalsIgnoreCase(code) || a.name().equalsIgnoreCase(code)) {
                return a;
            }
        }
        throw new CustomException(ErrorCode.INVALID_INPUT_VALUE, "Invalid usage action: " + code);
    }
}
