package com.nicuanalytics.exception;

public class InsufficientClaimsHistoryException extends NicuAnalyticsException {
    public InsufficientClaimsHistoryException(String message) {
        super("INSUFFICIENT_CLAIMS_HISTORY", message);
    }
}
