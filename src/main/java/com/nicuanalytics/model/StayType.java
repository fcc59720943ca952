package com.nicuanalytics.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum StayType {
    SHORT_STAY("Short Stay"),
    LONG_STAY("Long Stay");

    private final String label;

    StayType(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public static StayType forLengthOfStay(int lengthOfStay, int longStayThresholdDays) {
        return lengthOfStay >= longStayThresholdDays ? LONG_STAY : SHORT_STAY;
    }
}
