package com.nicuanalytics.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class EpisodeClaim {
    Baby baby;
    Claim claim;
    HospitalStay stay;
    StayType stayType;
    StudyYear studyYear;
}
