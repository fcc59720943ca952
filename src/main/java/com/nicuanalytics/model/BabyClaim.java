package com.nicuanalytics.model;

import lombok.Value;

@Value
public class BabyClaim {
    Baby baby;
    Claim claim;
    boolean highCost;
}
