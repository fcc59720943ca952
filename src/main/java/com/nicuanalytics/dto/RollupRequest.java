package com.nicuanalytics.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.nicuanalytics.model.Claim;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;
import java.util.List;

@Value
@Builder
@Jacksonized
public class RollupRequest {

    @NotBlank(message = "clientId is required")
    @Size(max = 100, message = "clientId must be at most 100 characters")
    String clientId;

    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate birthWindowStart;

    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate birthWindowMid;

    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate birthWindowEnd;

    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate runoutEnd;

    @NotEmpty(message = "claims must not be empty")
    List<Claim> claims;

    public boolean hasExplicitWindow() {
        return birthWindowStart != null || birthWindowMid != null || birthWindowEnd != null || runoutEnd != null;
    }
}
