package com.nicuanalytics.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

@Value
@Builder
public class HospitalStay {
    BabyKey babyKey;
    LocalDate deliveryDate;
    int ordinal;
    LocalDate admitDate;
    LocalDate dischargeDate;
    BigDecimal paidAmount;
    int lengthOfStay;
    boolean exceededRunout;

    public String getPatientId() {
        return babyKey.patientId();
    }
}
