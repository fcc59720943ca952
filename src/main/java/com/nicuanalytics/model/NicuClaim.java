package com.nicuanalytics.model;

import lombok.Value;

@Value
public class NicuClaim {
    EpisodeKey key;
    Claim claim;
    int stayLengthOfStay;
}
