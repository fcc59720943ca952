package com.nicuanalytics.model;

import java.time.LocalDate;
import java.util.Comparator;

public record BabyKey(String patientId, LocalDate birthDate) implements Comparable<BabyKey> {

    private static final Comparator<BabyKey> ORDER = Comparator
        .comparing(BabyKey::patientId)
        .thenComparing(BabyKey::birthDate, Comparator.nullsFirst(Comparator.naturalOrder()));

    public static BabyKey of(Claim claim) {
        return new BabyKey(claim.getPatientId(), claim.getBirthDate());
    }

    @Override
    public int compareTo(BabyKey other) {
        return ORDER.compare(this, other);
    }
}
