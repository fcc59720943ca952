package com.nicuanalytics.exception;

import lombok.Getter;

@Getter
public class MissingClaimFieldException extends NicuAnalyticsException {
    private final String field;

    public MissingClaimFieldException(String field, String claimNumber) {
        super("MISSING_CLAIM_FIELD",
              "Required claim field '" + field + "' is missing"
                  + (claimNumber != null ? " on claim '" + claimNumber + "'." : "."));
        this.field = field;
    }
}
