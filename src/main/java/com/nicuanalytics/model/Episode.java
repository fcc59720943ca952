package com.nicuanalytics.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

@Value
@Builder
public class Episode {
    EpisodeKey key;
    BabyKey babyKey;
    LocalDate deliveryDate;
    int lengthOfStay;
    StayType stayType;
    BirthType birthType;
    ContractType contract;
    String businessLine;
    String productCode;
    StudyYear studyYear;
    BigDecimal paidAmount;
    BabyType babyType;
}
