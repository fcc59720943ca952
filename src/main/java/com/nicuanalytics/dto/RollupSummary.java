package com.nicuanalytics.dto;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class RollupSummary {
    int claimCount;
    int hospitalStays;
    int newborns;
    int newbornsPreviousPeriod;
    int newbornsCurrentPeriod;
    int singleBirths;
    int twinBirths;
    int multipleBirths;
    int nicuCount;
    BigDecimal nicuRatePct;
    BigDecimal totalPaid;
    BigDecimal totalNicuCost;
    int nicuReadmissions;
    int lowPaidNicu;
    int inappropriateNicu;
}
