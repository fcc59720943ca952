package com.nicuanalytics.model;

import java.time.LocalDate;
import java.util.Comparator;

public record EpisodeKey(String patientId, LocalDate admitDate, LocalDate dischargeDate)
        implements Comparable<EpisodeKey> {

    private static final Comparator<EpisodeKey> ORDER = Comparator
        .comparing(EpisodeKey::patientId)
        .thenComparing(EpisodeKey::admitDate)
        .thenComparing(EpisodeKey::dischargeDate);

    @Override
    public int compareTo(EpisodeKey other) {
        return ORDER.compare(this, other);
    }
}
