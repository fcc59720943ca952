package com.nicuanalytics.service;

import com.nicuanalytics.config.RollupSettings;
import com.nicuanalytics.model.Claim;
import com.nicuanalytics.model.CostFeatures;
import com.nicuanalytics.model.EpisodeKey;
import com.nicuanalytics.model.HospitalStay;
import com.nicuanalytics.model.NicuClaim;
import com.nicuanalytics.model.NicuRecord;
import com.nicuanalytics.model.ProfessionalFees;
import com.nicuanalytics.model.Readmissions;
import com.nicuanalytics.model.ReferenceCodeSets;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

@Slf4j
@Service
@RequiredArgsConstructor
public class CostFeatureBuilder {

    private final RollupSettings settings;

    public CostFeatures build(List<NicuRecord> nicuRecords, List<NicuClaim> nicuClaims,
                              List<HospitalStay> stays, ReferenceCodeSets referenceCodes) {
        Map<EpisodeKey, Set<String>> diagnoses = diagnosesByEpisode(nicuClaims);
        CostFeatures features = CostFeatures.builder()
            .professionalFees(professionalFees(nicuClaims))
            .roomAndBoard(roomAndBoard(nicuClaims))
            .readmissions(readmissions(nicuRecords, stays))
            .nas(nas(diagnoses))
            .gestationalAge(firstCategoryPerPatient(diagnoses, referenceCodes.getGestationalAgeCategories()))
            .birthweight(firstCategoryPerPatient(diagnoses, referenceCodes.getBirthweightCategories()))
            .build();
        log.debug("Built cost features | episodes={} | readmitted={} | nas={}",
            features.getProfessionalFees().size(), features.getReadmissions().size(), features.getNas().size());
        return features;
    }

    Map<EpisodeKey, ProfessionalFees> professionalFees(List<NicuClaim> nicuClaims) {
        Map<EpisodeKey, FeeAccumulator> fees = new TreeMap<>();
        for (NicuClaim nicuClaim : nicuClaims) {
            Claim claim = nicuClaim.getClaim();
            if (!claim.hasProfessionalProcedure()) {
                continue;
            }
            fees.computeIfAbsent(nicuClaim.getKey(), k -> new FeeAccumulator()).add(claim);
        }
        Map<EpisodeKey, ProfessionalFees> result = new TreeMap<>();
        fees.forEach((key, acc) -> result.put(key, acc.toFees()));
        return result;
    }

    Map<EpisodeKey, BigDecimal> roomAndBoard(List<NicuClaim> nicuClaims) {
        Map<EpisodeKey, BigDecimal> result = new TreeMap<>();
        for (NicuClaim nicuClaim : nicuClaims) {
            Claim claim = nicuClaim.getClaim();
            String revenueCode = claim.getRevenueCode();
            if (claim.hasProfessionalProcedure() || revenueCode == null || revenueCode.length() < 3) {
                continue;
            }
            if (!settings.getRoomAndBoardRevenuePrefixes().contains(revenueCode.substring(0, 3))) {
                continue;
            }
            result.merge(nicuClaim.getKey(), amount(claim), BigDecimal::add);
        }
        return result;
    }

    Map<EpisodeKey, Readmissions> readmissions(List<NicuRecord> nicuRecords, List<HospitalStay> stays) {
        Map<String, List<HospitalStay>> staysByPatient = new HashMap<>();
        for (HospitalStay stay : stays) {
            staysByPatient.computeIfAbsent(stay.getPatientId(), k -> new ArrayList<>()).add(stay);
        }

        Map<EpisodeKey, Readmissions> result = new TreeMap<>();
        for (NicuRecord record : nicuRecords) {
            EpisodeKey key = record.getKey();
            Set<LocalDate> admits = new HashSet<>();
            BigDecimal paid = BigDecimal.ZERO;
            int lengthOfStay = 0;
            for (HospitalStay stay : staysByPatient.getOrDefault(key.patientId(), List.of())) {
                LocalDate readmit = stay.getAdmitDate();
                if (!readmit.isAfter(key.dischargeDate())
                        || ChronoUnit.DAYS.between(key.dischargeDate(), readmit) > settings.getReadmissionWindowDays()) {
                    continue;
                }
                admits.add(readmit);
                paid = paid.add(stay.getPaidAmount());
                lengthOfStay += stay.getLengthOfStay();
            }
            if (!admits.isEmpty()) {
                result.put(key, new Readmissions(admits.size(), paid, lengthOfStay));
            }
        }
        return result;
    }

    Map<EpisodeKey, Set<String>> diagnosesByEpisode(List<NicuClaim> nicuClaims) {
        Map<EpisodeKey, Set<String>> diagnoses = new TreeMap<>();
        for (NicuClaim nicuClaim : nicuClaims) {
            for (String code : nicuClaim.getClaim().getDiagnosisCodes()) {
                if (code != null && !code.isBlank()) {
                    diagnoses.computeIfAbsent(nicuClaim.getKey(), k -> new TreeSet<>()).add(code.trim());
                }
            }
        }
        return diagnoses;
    }

    Set<EpisodeKey> nas(Map<EpisodeKey, Set<String>> diagnoses) {
        Set<EpisodeKey> result = new TreeSet<>();
        diagnoses.forEach((key, codes) -> {
            if (codes.contains(settings.getNasDiagnosisCode())) {
                result.add(key);
            }
        });
        return result;
    }

    /**
     * One category per patient: the label that sorts first, attached to the episode it was found on.
     * Same-label ties go to the earliest episode.
     */
    Map<EpisodeKey, String> firstCategoryPerPatient(Map<EpisodeKey, Set<String>> diagnoses,
                                                    Map<String, String> categories) {
        Map<String, CategoryMatch> best = new HashMap<>();
        diagnoses.forEach((key, codes) -> {
            for (String code : codes) {
                String label = categories.get(code);
                if (label == null) {
                    continue;
                }
                best.merge(key.patientId(), new CategoryMatch(label, key),
                    (existing, candidate) -> CategoryMatch.ORDER.compare(candidate, existing) < 0 ? candidate : existing);
            }
        });
        Map<EpisodeKey, String> result = new TreeMap<>();
        best.values().forEach(match -> result.put(match.key(), match.label()));
        return result;
    }

    private static BigDecimal amount(Claim claim) {
        return claim.getPaidAmount() != null ? claim.getPaidAmount() : BigDecimal.ZERO;
    }

    private record CategoryMatch(String label, EpisodeKey key) {
        static final Comparator<CategoryMatch> ORDER = Comparator
            .comparing(CategoryMatch::label)
            .thenComparing(CategoryMatch::key);
    }

    private record ServiceDay(LocalDate serviceDate, String procedureCode) {}

    private final class FeeAccumulator {
        private BigDecimal total = BigDecimal.ZERO;
        private BigDecimal manageable = BigDecimal.ZERO;
        private BigDecimal criticalCare = BigDecimal.ZERO;
        private final Set<ServiceDay> manageableDays = new HashSet<>();
        private final Set<LocalDate> criticalCareDays = new HashSet<>();

        private void add(Claim claim) {
            String cpt = claim.getProfessionalProcedureCode().trim();
            BigDecimal paid = amount(claim);
            total = total.add(paid);
            if (settings.getManageableProcedureCodes().contains(cpt)) {
                manageable = manageable.add(paid);
                manageableDays.add(new ServiceDay(claim.getServiceFromDate(), cpt));
            }
            if (settings.getCriticalCareProcedureCodes().contains(cpt)) {
                criticalCare = criticalCare.add(paid);
                criticalCareDays.add(claim.getServiceFromDate());
            }
        }

        private ProfessionalFees toFees() {
            return ProfessionalFees.builder()
                .total(total)
                .manageable(manageable)
                .manageableServiceDays(manageableDays.size())
                .criticalCare(criticalCare)
                .criticalCareDays(criticalCareDays.size())
                .build();
        }
    }
}
