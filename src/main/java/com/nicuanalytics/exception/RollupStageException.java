package com.nicuanalytics.exception;

import lombok.Getter;

@Getter
public class RollupStageException extends NicuAnalyticsException {
    private final String stage;

    public RollupStageException(String stage, Throwable cause) {
        super("ROLLUP_STAGE_FAILED",
              "Rollup stage '" + stage + "' failed: "
                  + (cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName()),
              cause);
        this.stage = stage;
    }
}
