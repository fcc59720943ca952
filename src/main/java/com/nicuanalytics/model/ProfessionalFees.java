package com.nicuanalytics.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class ProfessionalFees {

    public static final ProfessionalFees NONE = ProfessionalFees.builder().build();

    @Builder.Default
    BigDecimal total = BigDecimal.ZERO;
    @Builder.Default
    BigDecimal manageable = BigDecimal.ZERO;
    int manageableServiceDays;
    @Builder.Default
    BigDecimal criticalCare = BigDecimal.ZERO;
    int criticalCareDays;
}
