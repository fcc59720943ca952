package com.nicuanalytics.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class RollupResult {
    RollupWindow window;
    int claimCount;
    List<HospitalStay> stays;
    List<NewbornRecord> newborns;
    List<NicuRollupRecord> nicuRecords;
    List<NewbornRollupRecord> records;

    public static RollupResult empty(RollupWindow window, int claimCount) {
        return RollupResult.builder()
            .window(window)
            .claimCount(claimCount)
            .stays(List.of())
            .newborns(List.of())
            .nicuRecords(List.of())
            .records(List.of())
            .build();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }
}
