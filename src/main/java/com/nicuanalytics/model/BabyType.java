package com.nicuanalytics.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum BabyType {
    NORMAL_NEWBORN("Normal Newborn"),
    NICU("NICU");

    private final String label;

    BabyType(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public boolean isNicu() {
        return this == NICU;
    }

    public static BabyType of(boolean anyNicu) {
        return anyNicu ? NICU : NORMAL_NEWBORN;
    }
}
