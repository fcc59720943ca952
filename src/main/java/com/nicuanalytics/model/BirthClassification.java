package com.nicuanalytics.model;

import lombok.Value;

import java.util.List;

@Value
public class BirthClassification {

    public static final BirthClassification EMPTY = new BirthClassification(List.of(), List.of());

    List<Baby> babies;
    List<BabyClaim> claims;

    public boolean isEmpty() {
        return babies.isEmpty();
    }
}
