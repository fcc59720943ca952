package com.nicuanalytics.service;

import com.nicuanalytics.dto.AsyncJobResponse;
import com.nicuanalytics.dto.AsyncJobStatus;
import com.nicuanalytics.exception.JobNotFoundException;
import com.nicuanalytics.exception.NicuAnalyticsException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Comparator;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Supplier;

@Slf4j
@Service
public class AsyncJobService {

    @Value("${jobs.pool-size:2}")
    private int poolSize;

    @Value("${jobs.max-retained:200}")
    private int maxRetained;

    private ExecutorService executor;
    private final ConcurrentHashMap<UUID, JobState> jobs = new ConcurrentHashMap<>();

    @PostConstruct
    void init() {
        executor = Executors.newFixedThreadPool(Math.max(1, poolSize));
    }

    @PreDestroy
    void shutdown() {
        if (executor != null) {
            executor.shutdown();
        }
    }

    public UUID submit(String jobType, String requestId, Supplier<Object> task) {
        UUID jobId = UUID.randomUUID();
        JobState state = new JobState(jobId, jobType, requestId, Instant.now());
        jobs.put(jobId, state);
        evictFinishedIfNeeded();

        CompletableFuture.runAsync(() -> execute(state, task), executor);
        log.info("Job queued | jobId={} | type={} | requestId={}", jobId, jobType, requestId);
        return jobId;
    }

    public AsyncJobResponse getJob(UUID jobId) {
        JobState state = jobs.get(jobId);
        if (state == null) {
            throw new JobNotFoundException(jobId);
        }
        return state.toResponse();
    }

    private void execute(JobState state, Supplier<Object> task) {
        state.markRunning();
        try {
            state.markCompleted(task.get());
            log.info("Job completed | jobId={} | requestId={}", state.jobId, state.requestId);
        } catch (NicuAnalyticsException ex) {
            state.markFailed(ex.getErrorCode(), ex.getMessage());
            log.warn("Job failed | jobId={} | errorCode={} | message={}", state.jobId, ex.getErrorCode(), ex.getMessage());
        } catch (Exception ex) {
            state.markFailed("INTERNAL_ERROR", ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName());
            log.error("Job failed | jobId={} | requestId={}", state.jobId, state.requestId, ex);
        }
    }

    private void evictFinishedIfNeeded() {
        if (jobs.size() <= maxRetained) {
            return;
        }
        jobs.entrySet().stream()
            .filter(e -> e.getValue().status == AsyncJobStatus.COMPLETED || e.getValue().status == AsyncJobStatus.FAILED)
            .sorted(Comparator.comparing(e -> e.getValue().createdAt))
            .limit(Math.max(1, jobs.size() - maxRetained))
            .map(Map.Entry::getKey)
            .forEach(jobs::remove);
    }

    private static final class JobState {
        private final UUID jobId;
        private final String jobType;
        private final String requestId;
        private final Instant createdAt;
        private volatile Instant startedAt;
        private volatile Instant completedAt;
        private volatile AsyncJobStatus status = AsyncJobStatus.QUEUED;
        private volatile String message = "Queued";
        private volatile String errorCode;
        private volatile Object result;

        private JobState(UUID jobId, String jobType, String requestId, Instant createdAt) {
            this.jobId = jobId;
            this.jobType = jobType;
            this.requestId = requestId;
            this.createdAt = createdAt;
        }

        private synchronized void markRunning() {
            this.startedAt = Instant.now();
            this.status = AsyncJobStatus.RUNNING;
            this.message = "Rollup running";
        }

        private synchronized void markCompleted(Object result) {
            this.completedAt = Instant.now();
            this.status = AsyncJobStatus.COMPLETED;
            this.result = result;
            this.message = "Rollup completed";
        }

        private synchronized void markFailed(String errorCode, String message) {
            this.completedAt = Instant.now();
            this.status = AsyncJobStatus.FAILED;
            this.errorCode = errorCode;
            this.message = message;
        }

        private synchronized AsyncJobResponse toResponse() {
            return AsyncJobResponse.builder()
                .jobId(jobId)
                .jobType(jobType)
                .status(status)
                .createdAt(createdAt)
                .startedAt(startedAt)
                .completedAt(completedAt)
                .message(message)
                .errorCode(errorCode)
                .result(result)
                .requestId(requestId)
                .build();
        }
    }
}
