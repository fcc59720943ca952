package com.nicuanalytics.service;

import com.nicuanalytics.exception.MissingClaimFieldException;
import com.nicuanalytics.model.Claim;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class ClaimValidator {

    public void validate(List<Claim> claims) {
        for (Claim claim : claims) {
            if (isBlank(claim.getClaimNumber())) {
                throw new MissingClaimFieldException("claimNumber", null);
            }
            if (isBlank(claim.getPatientId())) {
                throw new MissingClaimFieldException("patientId", claim.getClaimNumber());
            }
            if (claim.getServiceFromDate() == null) {
                throw new MissingClaimFieldException("serviceFromDate", claim.getClaimNumber());
            }
            if (claim.getBirthDate() == null) {
                throw new MissingClaimFieldException("birthDate", claim.getClaimNumber());
            }
            if (claim.getPaidAmount() == null) {
                throw new MissingClaimFieldException("paidAmount", claim.getClaimNumber());
            }
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
