package com.nicuanalytics.service;

import com.nicuanalytics.exception.MissingClaimFieldException;
import com.nicuanalytics.model.Claim;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.nicuanalytics.ClaimFixtures.*;
import static org.assertj.core.api.Assertions.*;

class ClaimValidatorTest {

    private final ClaimValidator validator = new ClaimValidator();

    @Test
    void validate_acceptsCompleteClaims() {
        assertThatCode(() -> validator.validate(List.of(
            inpatient("P1", "C1", "2023-01-01", "2023-01-03").build(),
            professional("P1", "C2", "2023-01-02", "99468").build())))
            .doesNotThrowAnyException();
    }

    @Test
    void validate_rejectsMissingPaidAmount() {
        Claim claim = inpatient("P1", "C7", "2023-01-01", "2023-01-03").paidAmount(null).build();

        assertThatThrownBy(() -> validator.validate(List.of(claim)))
            .isInstanceOf(MissingClaimFieldException.class)
            .hasMessageContaining("paidAmount")
            .hasMessageContaining("C7")
            .extracting("errorCode").isEqualTo("MISSING_CLAIM_FIELD");
    }

    @Test
    void validate_rejectsBlankPatientId() {
        Claim claim = inpatient(" ", "C1", "2023-01-01", "2023-01-03").build();

        assertThatThrownBy(() -> validator.validate(List.of(claim)))
            .isInstanceOf(MissingClaimFieldException.class)
            .extracting("field").isEqualTo("patientId");
    }

    @Test
    void validate_rejectsMissingBirthDate() {
        Claim claim = inpatient("P1", "C1", "2023-01-01", "2023-01-03").birthDate(null).build();

        assertThatThrownBy(() -> validator.validate(List.of(claim)))
            .isInstanceOf(MissingClaimFieldException.class)
            .extracting("field").isEqualTo("birthDate");
    }

    @Test
    void validate_rejectsMissingClaimNumber() {
        Claim claim = inpatient("P1", null, "2023-01-01", "2023-01-03").build();

        assertThatThrownBy(() -> validator.validate(List.of(claim)))
            .isInstanceOf(MissingClaimFieldException.class)
            .extracting("field").isEqualTo("claimNumber");
    }
}
