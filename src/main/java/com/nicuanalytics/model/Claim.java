package com.nicuanalytics.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class Claim {

    String patientId;
    String claimNumber;

    LocalDate serviceFromDate;
    LocalDate serviceThruDate;
    LocalDate paidDate;
    LocalDate admitDate;
    LocalDate dischargeDate;
    LocalDate birthDate;

    @Singular
    List<String> diagnosisCodes;
    @Singular
    List<String> procedureCodes;
    String professionalProcedureCode;

    String dischargeStatusCode;
    String revenueCode;
    String drgCode;
    String placeOfService;

    BigDecimal paidAmount;
    ClaimType claimType;

    String providerId;
    String providerTin;
    String providerName;
    String providerState;

    String businessLine;
    String productCode;

    @Builder.Default
    ReferenceFlags flags = ReferenceFlags.NONE;

    @JsonIgnore
    public LocalDate getAdmitOrServiceFrom() {
        return admitDate != null ? admitDate : serviceFromDate;
    }

    @JsonIgnore
    public LocalDate getDischargeOrServiceThru() {
        if (dischargeDate != null) {
            return dischargeDate;
        }
        return serviceThruDate != null ? serviceThruDate : serviceFromDate;
    }

    public boolean hasProfessionalProcedure() {
        return professionalProcedureCode != null && !professionalProcedureCode.isBlank();
    }

    @JsonIgnore
    public BirthType getBirthType() {
        return BirthType.fromFlags(flags);
    }
}
