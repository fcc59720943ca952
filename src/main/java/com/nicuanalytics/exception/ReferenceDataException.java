package com.nicuanalytics.exception;

public class ReferenceDataException extends NicuAnalyticsException {
    public ReferenceDataException(String message) {
        super("REFERENCE_DATA_ERROR", message);
    }
    public ReferenceDataException(String message, Throwable cause) {
        super("REFERENCE_DATA_ERROR", message, cause);
    }
}
