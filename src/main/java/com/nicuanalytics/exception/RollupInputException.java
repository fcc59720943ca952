package com.nicuanalytics.exception;

public class RollupInputException extends NicuAnalyticsException {
    public RollupInputException(String message) {
        super("ROLLUP_INPUT_ERROR", message);
    }
}
