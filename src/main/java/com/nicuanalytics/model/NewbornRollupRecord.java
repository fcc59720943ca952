package com.nicuanalytics.model;

import com.fasterxml.jackson.annotation.JsonUnwrapped;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

@Value
@Builder
public class NewbornRollupRecord {
    String patientId;
    LocalDate birthDate;
    LocalDate deliveryDate;
    String businessLine;
    String productCode;
    StudyYear studyYear;
    LocalDate admitDate;
    LocalDate dischargeDate;
    int lengthOfStay;
    BigDecimal paidAmount;
    BigDecimal costPerDay;
    BabyType babyType;
    BirthType birthType;
    ContractType contract;

    @JsonUnwrapped
    NicuRollupRecord nicu;
}
