package com.nicuanalytics.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

@Value
@Builder
public class ProviderAttribution {
    String providerId;
    String providerTin;
    String providerName;
    String providerState;
    BigDecimal paidAmount;
    LocalDate admitDate;
    LocalDate dischargeDate;
    int lengthOfStay;
}
