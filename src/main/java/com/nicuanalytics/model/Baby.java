package com.nicuanalytics.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

@Value
@Builder
public class Baby {
    BabyKey key;
    BirthType birthType;
    LocalDate deliveryDate;
    boolean inInitialWindow;
    BabyType babyType;
    ContractType contract;

    public String getPatientId() {
        return key.patientId();
    }

    public LocalDate getBirthDate() {
        return key.birthDate();
    }
}
