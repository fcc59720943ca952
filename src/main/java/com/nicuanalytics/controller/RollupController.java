package com.nicuanalytics.controller;

import com.nicuanalytics.dto.AsyncJobResponse;
import com.nicuanalytics.dto.RollupRequest;
import com.nicuanalytics.dto.RollupResponse;
import com.nicuanalytics.dto.RollupRunResponse;
import com.nicuanalytics.service.AsyncJobService;
import com.nicuanalytics.service.ReferenceDataService;
import com.nicuanalytics.service.RollupService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class RollupController {

    private final RollupService        rollupService;
    private final AsyncJobService      asyncJobService;
    private final ReferenceDataService referenceDataService;

    @PostMapping("/rollups")
    public ResponseEntity<RollupResponse> rollup(
            @Valid @RequestBody RollupRequest request, HttpServletRequest httpRequest) {
        String requestId = resolveRequestId(httpRequest);
        log.info("POST /rollups | client={} | claims={} | requestId={}",
                 request.getClientId(), request.getClaims().size(), requestId);
        return ResponseEntity.ok()
            .header("X-Request-ID", requestId)
            .body(rollupService.runRollup(request, requestId));
    }

    @PostMapping("/rollups/async")
    public ResponseEntity<AsyncJobResponse> rollupAsync(
            @Valid @RequestBody RollupRequest request, HttpServletRequest httpRequest) {
        String requestId = resolveRequestId(httpRequest);
        log.info("POST /rollups/async | client={} | claims={} | requestId={}",
                 request.getClientId(), request.getClaims().size(), requestId);
        UUID jobId = asyncJobService.submit(
            "NICU_ROLLUP",
            requestId,
            () -> rollupService.runRollup(request, requestId)
        );
        return ResponseEntity.accepted()
            .header("X-Request-ID", requestId)
            .header("Location", "/api/v1/jobs/" + jobId)
            .body(asyncJobService.getJob(jobId));
    }

    @GetMapping("/jobs/{jobId}")
    public ResponseEntity<AsyncJobResponse> jobStatus(@PathVariable UUID jobId) {
        return ResponseEntity.ok(asyncJobService.getJob(jobId));
    }

    @GetMapping("/rollups/history")
    public ResponseEntity<Page<RollupRunResponse>> history(
            @RequestParam(required = false) String clientId,
            @RequestParam(defaultValue = "0") @Min(0) int page,
            @RequestParam(defaultValue = "20") @Min(1) @Max(100) int size) {
        return ResponseEntity.ok(rollupService.getHistory(clientId, PageRequest.of(page, size)));
    }

    @PostMapping("/reference-data/refresh")
    public ResponseEntity<Void> refreshReferenceData() {
        referenceDataService.evictAll();
        return ResponseEntity.noContent().build();
    }

    private String resolveRequestId(HttpServletRequest request) {
        String id = request.getHeader("X-Request-ID");
        return (id != null && !id.isBlank()) ? id : UUID.randomUUID().toString();
    }
}
