package com.nicuanalytics.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ClaimType {
    INPATIENT("IP"),
    EMERGENCY("ER"),
    OUTPATIENT("OP");

    private final String code;

    ClaimType(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static ClaimType fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (ClaimType type : values()) {
            if (type.code.equalsIgnoreCase(code) || type.name().equalsIgnoreCase(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown ClaimType: " + code);
    }
}
