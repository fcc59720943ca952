package com.nicuanalytics.exception;

import lombok.Getter;

@Getter
public abstract class NicuAnalyticsException extends RuntimeException {
    private final String errorCode;
    protected NicuAnalyticsException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    protected NicuAnalyticsException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
