package com.nicuanalytics.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Set;

@Value
@Builder
public class CostFeatures {
    Map<EpisodeKey, ProfessionalFees> professionalFees;
    Map<EpisodeKey, BigDecimal> roomAndBoard;
    Map<EpisodeKey, Readmissions> readmissions;
    Set<EpisodeKey> nas;
    Map<EpisodeKey, String> gestationalAge;
    Map<EpisodeKey, String> birthweight;
}
