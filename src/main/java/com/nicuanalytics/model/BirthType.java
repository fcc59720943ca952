package com.nicuanalytics.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum BirthType {
    UNKNOWN(0, "Unknown"),
    SINGLE(1, "Single"),
    TWIN(2, "Twin"),
    MULTIPLE(3, "Multiple");

    private final int priority;
    private final String label;

    BirthType(int priority, String label) {
        this.priority = priority;
        this.label = label;
    }

    public int getPriority() {
        return priority;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public static BirthType fromPriority(int priority) {
        for (BirthType type : values()) {
            if (type.priority == priority) {
                return type;
            }
        }
        return UNKNOWN;
    }

    public static BirthType fromFlags(ReferenceFlags flags) {
        if (flags == null) {
            return UNKNOWN;
        }
        if (flags.isMultiple()) return MULTIPLE;
        if (flags.isTwin()) return TWIN;
        if (flags.isSingle()) return SINGLE;
        return UNKNOWN;
    }
}
