package com.nicuanalytics.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum StudyYear {
    PREVIOUS("Previous"),
    CURRENT("Current");

    private final String label;

    StudyYear(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
