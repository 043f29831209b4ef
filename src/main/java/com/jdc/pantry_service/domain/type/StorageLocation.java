package com.jdc.pantry_service.domain.type;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.jdc.pantry_service.exception.CustomException;
import com.jdc.pantry_service.exception.ErrorCode;

public enum StorageLocation {
    FRIDGE("fridge"),
    FREEZER("freezer"),
    PANTRY("pantry"),
    COUNTER("counter"),
    OTHER("other");

    private final String code;

    StorageLocation(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static StorageLocation fromCode(String code) {
        for (StorageLocation l : values()) {
            if (l.code.equalsIgnoreCase(code) || l.name().equalsIgnoreCase(code)) {
                return l;
            }
        }
        throw new CustomException(ErrorCode.INVALID_INPUT_VALUE, "Invalid storage location: " + code);
    }
}
