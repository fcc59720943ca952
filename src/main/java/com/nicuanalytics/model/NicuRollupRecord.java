package com.nicuanalytics.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class NicuRollupRecord {

    @JsonIgnore
    NewbornRecord newborn;

    BigDecimal totalNicuCost;
    BigDecimal professionalFee;
    BigDecimal manageableProfessionalFee;
    int manageableServiceDays;
    BigDecimal criticalCareProfessionalFee;
    int criticalCareDays;
    BigDecimal roomAndBoardCost;
    BigDecimal facilityCost;

    int readmissions;
    BigDecimal readmissionPaidAmount;
    int readmissionLengthOfStay;

    boolean nas;
    String gestationalAgeCategory;
    String birthweightCategory;

    String finalRevenueCode;
    boolean revenueLeveling;
    String finalDrgCode;
    String dischargeStatus;

    String providerId;
    String providerTin;
    String providerName;
    String providerState;

    boolean lowPaidNicu;
    boolean inappropriateNicu;

    @JsonIgnore
    public EpisodeKey getKey() {
        return newborn.getKey();
    }
}
