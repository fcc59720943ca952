package com.nicuanalytics.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class RollupRunResponse {
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
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant createdAt;
    String requestId;
}
