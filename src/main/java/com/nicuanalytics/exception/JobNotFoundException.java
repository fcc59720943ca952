package com.nicuanalytics.exception;

import java.util.UUID;

public class JobNotFoundException extends NicuAnalyticsException {
    public JobNotFoundException(UUID jobId) {
        super("JOB_NOT_FOUND", "Rollup job with id '" + jobId + "' not found.");
    }
}
