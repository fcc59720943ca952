package com.nicuanalytics.exception;

public class ReferenceDataUnavailableException extends NicuAnalyticsException {
    public ReferenceDataUnavailableException(Throwable cause) {
        super("REFERENCE_DATA_UNAVAILABLE",
              "The reference data service is currently unavailable. Please try again later.",
              cause);
    }
}
