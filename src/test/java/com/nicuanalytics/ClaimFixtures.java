package com.nicuanalytics;

import com.nicuanalytics.model.Baby;
import com.nicuanalytics.model.BabyKey;
import com.nicuanalytics.model.BabyType;
import com.nicuanalytics.model.BirthType;
import com.nicuanalytics.model.Claim;
import com.nicuanalytics.model.ClaimType;
import com.nicuanalytics.model.ContractType;
import com.nicuanalytics.model.NewbornRecord;
import com.nicuanalytics.model.ReferenceFlags;
import com.nicuanalytics.model.RollupWindow;
import com.nicuanalytics.model.StudyYear;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Builders for claims and rollup inputs shared across tests.
 */
public final class ClaimFixtures {

    public static final LocalDate BIRTH_DATE = LocalDate.of(2023, 1, 1);

    public static final RollupWindow WINDOW = RollupWindow.builder()
        .birthWindowStart(LocalDate.of(2022, 7, 1))
        .birthWindowMid(LocalDate.of(2023, 7, 1))
        .birthWindowEnd(LocalDate.of(2024, 6, 30))
        .runoutEnd(LocalDate.of(2024, 9, 30))
        .build();

    public static final ReferenceFlags NEWBORN = ReferenceFlags.builder()
        .newbornIcd(true).single(true).build();

    public static final ReferenceFlags NICU = ReferenceFlags.builder()
        .newbornIcd(true).single(true).nicuRevenue(true).build();

    public static final ReferenceFlags NICU_DRG = ReferenceFlags.builder()
        .newbornIcd(true).single(true).nicuRevenue(true).nicuMsDrg(true).build();

    private ClaimFixtures() {
    }

    public static LocalDate date(String iso) {
        return LocalDate.parse(iso);
    }

    public static BigDecimal money(String amount) {
        return new BigDecimal(amount);
    }

    /**
     * An inpatient facility line with admit/discharge equal to its service dates.
     */
    public static Claim.ClaimBuilder inpatient(String patientId, String claimNumber, String from, String thru) {
        return line(patientId, claimNumber, from, thru)
            .admitDate(date(from))
            .dischargeDate(date(thru))
            .claimType(ClaimType.INPATIENT);
    }

    /**
     * A professional line: CPT code, no admit/discharge dates.
     */
    public static Claim.ClaimBuilder professional(String patientId, String claimNumber, String serviceDate, String cpt) {
        return line(patientId, claimNumber, serviceDate, serviceDate)
            .professionalProcedureCode(cpt)
            .claimType(ClaimType.OUTPATIENT);
    }

    public static Claim.ClaimBuilder line(String patientId, String claimNumber, String from, String thru) {
        return Claim.builder()
            .patientId(patientId)
            .claimNumber(claimNumber)
            .birthDate(BIRTH_DATE)
            .serviceFromDate(date(from))
            .serviceThruDate(date(thru))
            .paidDate(date(thru).plusDays(30))
            .paidAmount(money("1000"))
            .businessLine("Commercial")
            .productCode("PPO");
    }

    public static Baby baby(String patientId, String deliveryDate, BabyType babyType, ContractType contract) {
        return Baby.builder()
            .key(new BabyKey(patientId, BIRTH_DATE))
            .birthType(BirthType.SINGLE)
            .deliveryDate(date(deliveryDate))
            .inInitialWindow(true)
            .babyType(babyType)
            .contract(contract)
            .build();
    }

    public static NewbornRecord.NewbornRecordBuilder newborn(String patientId, String admit, String discharge) {
        return NewbornRecord.builder()
            .patientId(patientId)
            .birthDate(BIRTH_DATE)
            .deliveryDate(date(admit))
            .businessLine("Commercial")
            .productCode("PPO")
            .studyYear(StudyYear.PREVIOUS)
            .admitDate(date(admit))
            .dischargeDate(date(discharge))
            .paidAmount(money("1000"))
            .lengthOfStay((int) ChronoUnit.DAYS.between(date(admit), date(discharge)))
            .babyType(BabyType.NICU)
            .birthType(BirthType.SINGLE)
            .contract(ContractType.DRG);
    }
}
