package com.nicuanalytics.model;

import lombok.Value;

import java.util.Map;

@Value
public class CodeFeatures {
    Map<EpisodeKey, RevenueCodeFeature> revenueCodes;
    Map<EpisodeKey, String> drgCodes;
}
