package com.nicuanalytics.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class EpisodeIdentification {

    public static final EpisodeIdentification EMPTY = EpisodeIdentification.builder()
        .hospitalClaims(List.of())
        .episodes(List.of())
        .newborns(List.of())
        .nicuRecords(List.of())
        .nicuClaims(List.of())
        .build();

    List<EpisodeClaim> hospitalClaims;
    List<Episode> episodes;
    List<NewbornRecord> newborns;
    List<NicuRecord> nicuRecords;
    List<NicuClaim> nicuClaims;
}
