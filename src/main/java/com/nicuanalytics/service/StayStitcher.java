package com.nicuanalytics.service;

import com.nicuanalytics.config.RollupSettings;
import com.nicuanalytics.model.BabyClaim;
import com.nicuanalytics.model.BabyKey;
import com.nicuanalytics.model.Claim;
import com.nicuanalytics.model.ClaimType;
import com.nicuanalytics.model.HospitalStay;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

@Slf4j
@Service
@RequiredArgsConstructor
public class StayStitcher {

    private static final Comparator<Claim> STAY_ORDER = Comparator
        .comparing(Claim::getAdmitOrServiceFrom)
        .thenComparing(Claim::getDischargeOrServiceThru)
        .thenComparing(Claim::getClaimNumber);

    private final RollupSettings settings;

    public List<HospitalStay> stitch(List<BabyClaim> claims, LocalDate runoutEnd) {
        Map<StayPartition, List<Claim>> partitions = new TreeMap<>();
        for (BabyClaim babyClaim : claims) {
            if (!isEligible(babyClaim)) {
                continue;
            }
            StayPartition partition = new StayPartition(
                babyClaim.getBaby().getKey(), babyClaim.getBaby().getDeliveryDate());
            partitions.computeIfAbsent(partition, k -> new ArrayList<>()).add(babyClaim.getClaim());
        }

        List<HospitalStay> stays = new ArrayList<>();
        partitions.forEach((partition, partitionClaims) ->
            stays.addAll(stitchPartition(partition, partitionClaims, runoutEnd)));
        log.debug("Stitched hospital stays | partitions={} | stays={}", partitions.size(), stays.size());
        return List.copyOf(stays);
    }

    private boolean isEligible(BabyClaim babyClaim) {
        Claim claim = babyClaim.getClaim();
        LocalDate deliveryDate = babyClaim.getBaby().getDeliveryDate();
        return !babyClaim.isHighCost()
            && claim.getClaimType() == ClaimType.INPATIENT
            && (!claim.getAdmitOrServiceFrom().isBefore(deliveryDate)
                || !claim.getServiceFromDate().isBefore(deliveryDate));
    }

    private List<HospitalStay> stitchPartition(StayPartition partition, List<Claim> claims, LocalDate runoutEnd) {
        List<Claim> ordered = claims.stream().sorted(STAY_ORDER).toList();

        List<StayAccumulator> accumulators = new ArrayList<>();
        StayAccumulator current = null;
        LocalDate previousDischarge = null;
        for (Claim claim : ordered) {
            LocalDate admit = claim.getAdmitOrServiceFrom();
            LocalDate discharge = claim.getDischargeOrServiceThru();
            if (previousDischarge == null
                    || ChronoUnit.DAYS.between(previousDischarge, admit) > settings.getHospitalGapDays()) {
                current = new StayAccumulator(accumulators.size() + 1);
                accumulators.add(current);
            }
            current.add(admit, discharge, claim.getPaidAmount());
            previousDischarge = discharge;
        }

        List<HospitalStay> stays = new ArrayList<>();
        for (StayAccumulator acc : accumulators) {
            boolean exceededRunout = acc.discharge.isAfter(runoutEnd);
            LocalDate discharge = exceededRunout ? runoutEnd : acc.discharge;
            LocalDate admit = acc.admit.isBefore(partition.deliveryDate()) ? partition.deliveryDate() : acc.admit;
            int lengthOfStay = lengthOfStay(admit, discharge);
            if (lengthOfStay < 1) {
                continue;
            }
            stays.add(HospitalStay.builder()
                .babyKey(partition.babyKey())
                .deliveryDate(partition.deliveryDate())
                .ordinal(acc.ordinal)
                .admitDate(admit)
                .dischargeDate(discharge)
                .paidAmount(acc.paid)
                .lengthOfStay(lengthOfStay)
                .exceededRunout(exceededRunout)
                .build());
        }
        return stays;
    }

    // a same-day stay counts as one day
    static int lengthOfStay(LocalDate admit, LocalDate discharge) {
        if (admit.equals(discharge)) {
            return 1;
        }
        return (int) ChronoUnit.DAYS.between(admit, discharge);
    }

    private record StayPartition(BabyKey babyKey, LocalDate deliveryDate) implements Comparable<StayPartition> {
        @Override
        public int compareTo(StayPartition other) {
            int byBaby = babyKey.compareTo(other.babyKey);
            return byBaby != 0 ? byBaby : deliveryDate.compareTo(other.deliveryDate);
        }
    }

    private static final class StayAccumulator {
        private final int ordinal;
        private LocalDate admit;
        private LocalDate discharge;
        private BigDecimal paid = BigDecimal.ZERO;

        private StayAccumulator(int ordinal) {
            this.ordinal = ordinal;
        }

        private void add(LocalDate claimAdmit, LocalDate claimDischarge, BigDecimal amount) {
            if (admit == null || claimAdmit.isBefore(admit)) {
                admit = claimAdmit;
            }
            if (discharge == null || claimDischarge.isAfter(discharge)) {
                discharge = claimDischarge;
            }
            if (amount != null) {
                paid = paid.add(amount);
            }
        }
    }
}
