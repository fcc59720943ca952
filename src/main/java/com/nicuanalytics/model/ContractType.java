package com.nicuanalytics.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ContractType {
    PER_DIEM("Per-Diem"),
    DRG("DRG");

    private final String label;

    ContractType(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public static ContractType of(boolean anyDrg) {
        return anyDrg ? DRG : PER_DIEM;
    }
}
