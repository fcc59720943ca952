package com.nicuanalytics.model;

import lombok.Value;

import java.math.BigDecimal;

@Value
public class NicuRecord {
    NewbornRecord newborn;

    public EpisodeKey getKey() {
        return newborn.getKey();
    }

    public BigDecimal getTotalNicuCost() {
        return newborn.getPaidAmount();
    }

    public int getLengthOfStay() {
        return newborn.getLengthOfStay();
    }
}
