package com.nicuanalytics.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.nicuanalytics.model.NewbornRollupRecord;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class RollupResponse {
    UUID runId;
    String clientId;
    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate birthWindowStart;
    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate birthWindowMid;
    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate birthWindowEnd;
    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate runoutEnd;
    RollupSummary summary;
    List<NewbornRollupRecord> records;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant createdAt;
    String requestId;
}
