package com.nicuanalytics.model;

import lombok.Value;

@Value
public class RevenueCodeFeature {
    String finalRevenueCode;
    boolean leveling;
}
