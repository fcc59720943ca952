package com.nicuanalytics.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

@Value
@Builder
public class RollupWindow {
    LocalDate birthWindowStart;
    LocalDate birthWindowMid;
    LocalDate birthWindowEnd;
    LocalDate runoutEnd;

    public StudyYear studyYearOf(LocalDate deliveryDate) {
        boolean previous = !deliveryDate.isBefore(birthWindowStart) && deliveryDate.isBefore(birthWindowMid);
        return previous ? StudyYear.PREVIOUS : StudyYear.CURRENT;
    }
}
