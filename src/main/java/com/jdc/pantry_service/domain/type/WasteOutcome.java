package com.jdc.pantry_service.domain.type;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.jdc.pantry_service.exception.CustomException;
import com.jdc.pantry_service.exception.ErrorCode;

public enum WasteOutcome {
    THROWN_OUT("thrown_out"),
    COMPOSTED("composted"),
    FED_TO_ANIMALS("fed_to_animals"),
    OTHER("other");

    private final String code;

    WasteOutcome(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static WasteOutcome fromCode(String code) {
        for (WasteOutcome o : values()) {
            if (o.code.equalsIgnoreCase(code) || o.name().equalsIgnoreCase(code)) {
                return o;
            }
        }
        throw new CustomException(ErrorCode.INVALID_INPUT_VALUE, "Invalid waste outcome: " + code);
    }
}
