package com.nicuanalytics.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

@Value
@Builder
public class NewbornRecord {
    String patientId;
    LocalDate birthDate;
    LocalDate deliveryDate;
    String businessLine;
    String productCode;
    StudyYear studyYear;
    LocalDate admitDate;
    LocalDate dischargeDate;
    BigDecimal paidAmount;
    int lengthOfStay;
    BabyType babyType;
    BirthType birthType;
    ContractType contract;

    public EpisodeKey getKey() {
        return new EpisodeKey(patientId, admitDate, dischargeDate);
    }
}
