package com.nicuanalytics.service;

import com.nicuanalytics.config.RollupSettings;
import com.nicuanalytics.model.Baby;
import com.nicuanalytics.model.BabyClaim;
import com.nicuanalytics.model.BabyKey;
import com.nicuanalytics.model.BabyType;
import com.nicuanalytics.model.BirthClassification;
import com.nicuanalytics.model.BirthType;
import com.nicuanalytics.model.Claim;
import com.nicuanalytics.model.ContractType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

@Slf4j
@Service
@RequiredArgsConstructor
public class BirthClassifier {

    private final RollupSettings settings;

    public BirthClassification classify(List<Claim> claims) {
        Map<BabyKey, List<Claim>> newbornClaims = new TreeMap<>();
        Map<String, List<Claim>> claimsByPatient = new TreeMap<>();
        for (Claim claim : claims) {
            claimsByPatient.computeIfAbsent(claim.getPatientId(), k -> new ArrayList<>()).add(claim);
            if (claim.getFlags().isNewborn()) {
                newbornClaims.computeIfAbsent(BabyKey.of(claim), k -> new ArrayList<>()).add(claim);
            }
        }
        if (newbornClaims.isEmpty()) {
            return BirthClassification.EMPTY;
        }

        List<Baby> babies = new ArrayList<>();
        List<BabyClaim> babyClaims = new ArrayList<>();
        for (Map.Entry<BabyKey, List<Claim>> entry : newbornClaims.entrySet()) {
            Baby baby = classifyBaby(entry.getKey(), entry.getValue());
            babies.add(baby);
            // joined on patient alone: later claims may carry a different birth date
            for (Claim claim : claimsByPatient.get(entry.getKey().patientId())) {
                if (claim.getServiceFromDate().isBefore(baby.getDeliveryDate())) {
                    continue;
                }
                babyClaims.add(new BabyClaim(baby, claim, isHighCost(claim)));
            }
        }

        log.debug("Classified babies | babies={} | claims={}", babies.size(), babyClaims.size());
        return new BirthClassification(List.copyOf(babies), List.copyOf(babyClaims));
    }

    Baby classifyBaby(BabyKey key, List<Claim> newbornClaims) {
        int maxPriority = 0;
        boolean anyNicu = false;
        boolean anyNicuDrg = false;
        LocalDate deliveryDate = null;
        for (Claim claim : newbornClaims) {
            maxPriority = Math.max(maxPriority, claim.getBirthType().getPriority());
            anyNicu |= claim.getFlags().isAnyNicu();
            anyNicuDrg |= claim.getFlags().isAnyNicuDrg();
            LocalDate serviceDate = claim.getServiceFromDate();
            if (deliveryDate == null || serviceDate.isBefore(deliveryDate)) {
                deliveryDate = serviceDate;
            }
        }

        boolean inInitialWindow = key.birthDate() != null
            && Math.abs(ChronoUnit.DAYS.between(key.birthDate(), deliveryDate)) <= settings.getInitialWindowDays();

        return Baby.builder()
            .key(key)
            .birthType(BirthType.fromPriority(maxPriority))
            .deliveryDate(deliveryDate)
            .inInitialWindow(inInitialWindow)
            .babyType(BabyType.of(anyNicu))
            .contract(ContractType.of(anyNicuDrg))
            .build();
    }

    boolean isHighCost(Claim claim) {
        return claim.getPaidAmount() != null && claim.getPaidAmount().compareTo(settings.getHighCostCeiling()) > 0;
    }
}
