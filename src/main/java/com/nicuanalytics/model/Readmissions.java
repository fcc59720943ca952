package com.nicuanalytics.model;

import lombok.Value;

import java.math.BigDecimal;

@Value
public class Readmissions {

    public static final Readmissions NONE = new Readmissions(0, BigDecimal.ZERO, 0);

    int count;
    BigDecimal paidAmount;
    int lengthOfStay;
}
