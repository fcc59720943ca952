package com.nicuanalytics.service;

import com.nicuanalytics.config.RollupSettings;
import com.nicuanalytics.model.Baby;
import com.nicuanalytics.model.BabyClaim;
import com.nicuanalytics.model.BabyKey;
import com.nicuanalytics.model.BabyType;
import com.nicuanalytics.model.BirthType;
import com.nicuanalytics.model.Claim;
import com.nicuanalytics.model.ContractType;
import com.nicuanalytics.model.Episode;
import com.nicuanalytics.model.EpisodeClaim;
import com.nicuanalytics.model.EpisodeIdentification;
import com.nicuanalytics.model.EpisodeKey;
import com.nicuanalytics.model.HospitalStay;
import com.nicuanalytics.model.NewbornRecord;
import com.nicuanalytics.model.NicuClaim;
import com.nicuanalytics.model.NicuRecord;
import com.nicuanalytics.model.RollupWindow;
import com.nicuanalytics.model.StayType;
import com.nicuanalytics.model.StudyYear;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class EpisodeBuilder {

    /** Highest-information line wins: latest thru date, then latest from date. */
    private static final Comparator<EpisodeClaim> CLAIM_LINE_PRIORITY = Comparator
        .comparing((EpisodeClaim c) -> c.getClaim().getServiceThruDate(),
            Comparator.nullsLast(Comparator.<LocalDate>reverseOrder()))
        .thenComparing(c -> c.getClaim().getServiceFromDate(),
            Comparator.nullsLast(Comparator.<LocalDate>reverseOrder()))
        .thenComparing(c -> c.getStay().getAdmitDate())
        .thenComparing(c -> c.getStay().getDischargeDate())
        .thenComparing(c -> c.getClaim().getPaidAmount(),
            Comparator.nullsLast(Comparator.<BigDecimal>reverseOrder()))
        .thenComparing(c -> c.getClaim().getRevenueCode(), Comparator.nullsLast(Comparator.<String>naturalOrder()))
        .thenComparing(c -> c.getClaim().getProfessionalProcedureCode(),
            Comparator.nullsLast(Comparator.<String>naturalOrder()));

    private static final Comparator<String> TEXT = Comparator.nullsFirst(Comparator.naturalOrder());

    private static final Comparator<NewbornRecord> NEWBORN_ORDER = Comparator
        .comparing(NewbornRecord::getKey)
        .thenComparing(NewbornRecord::getBusinessLine, TEXT)
        .thenComparing(NewbornRecord::getProductCode, TEXT)
        .thenComparing(NewbornRecord::getStudyYear);

    private static final Comparator<Episode> EPISODE_ORDER = Comparator
        .comparing(Episode::getKey)
        .thenComparing(Episode::getBusinessLine, TEXT)
        .thenComparing(Episode::getProductCode, TEXT)
        .thenComparing(Episode::getStudyYear);

    private final RollupSettings settings;

    public EpisodeIdentification build(List<BabyClaim> claims, List<HospitalStay> stays, RollupWindow window) {
        if (stays.isEmpty()) {
            return EpisodeIdentification.EMPTY;
        }
        List<EpisodeClaim> windowed = joinToStays(claims, stays, window);
        List<EpisodeClaim> hospitalClaims = deduplicate(windowed);
        List<Episode> episodes = rollupEpisodes(hospitalClaims);
        List<NewbornRecord> newborns = rollupNewborns(episodes);
        List<NicuRecord> nicuRecords = newborns.stream()
            .filter(n -> n.getBabyType().isNicu())
            .map(NicuRecord::new)
            .toList();
        List<NicuClaim> nicuClaims = nicuClaims(hospitalClaims, nicuRecords);

        log.debug("Identified episodes | claimLines={} | episodes={} | newborns={} | nicu={}",
            hospitalClaims.size(), episodes.size(), newborns.size(), nicuRecords.size());
        return EpisodeIdentification.builder()
            .hospitalClaims(hospitalClaims)
            .episodes(episodes)
            .newborns(newborns)
            .nicuRecords(nicuRecords)
            .nicuClaims(nicuClaims)
            .build();
    }

    List<EpisodeClaim> joinToStays(List<BabyClaim> claims, List<HospitalStay> stays, RollupWindow window) {
        Map<StayPartition, List<HospitalStay>> staysByPartition = new HashMap<>();
        for (HospitalStay stay : stays) {
            staysByPartition.computeIfAbsent(new StayPartition(stay.getBabyKey(), stay.getDeliveryDate()),
                k -> new ArrayList<>()).add(stay);
        }

        List<EpisodeClaim> joined = new ArrayList<>();
        for (BabyClaim babyClaim : claims) {
            if (babyClaim.isHighCost()) {
                continue;
            }
            Baby baby = babyClaim.getBaby();
            Claim claim = babyClaim.getClaim();
            List<HospitalStay> candidates = staysByPartition.getOrDefault(
                new StayPartition(baby.getKey(), baby.getDeliveryDate()), List.of());
            for (HospitalStay stay : candidates) {
                LocalDate serviceDate = claim.getServiceFromDate();
                if (serviceDate.isBefore(stay.getAdmitDate()) || serviceDate.isAfter(stay.getDischargeDate())) {
                    continue;
                }
                if (!isIndexHospitalization(stay)) {
                    continue;
                }
                joined.add(EpisodeClaim.builder()
                    .baby(baby)
                    .claim(claim)
                    .stay(stay)
                    .stayType(StayType.forLengthOfStay(stay.getLengthOfStay(), settings.getLongStayThresholdDays()))
                    .studyYear(window.studyYearOf(stay.getDeliveryDate()))
                    .build());
            }
        }
        return joined;
    }

    boolean isIndexHospitalization(HospitalStay stay) {
        LocalDate deliveryDate = stay.getDeliveryDate();
        boolean inInitialWindow = !stay.getAdmitDate().isAfter(deliveryDate.plusDays(settings.getInitialWindowDays()));
        long admitGap = ChronoUnit.DAYS.between(deliveryDate, stay.getAdmitDate());
        return admitGap < settings.getReadmissionWindowDays() && inInitialWindow;
    }

    List<EpisodeClaim> deduplicate(List<EpisodeClaim> joined) {
        Map<ClaimLineKey, EpisodeClaim> best = new LinkedHashMap<>();
        for (EpisodeClaim row : joined) {
            ClaimLineKey key = new ClaimLineKey(
                row.getClaim().getPatientId(), row.getStay().getDeliveryDate(), row.getClaim().getClaimNumber());
            best.merge(key, row, (existing, candidate) ->
                CLAIM_LINE_PRIORITY.compare(candidate, existing) < 0 ? candidate : existing);
        }
        return List.copyOf(best.values());
    }

    List<Episode> rollupEpisodes(List<EpisodeClaim> claimLines) {
        Map<EpisodeGroup, EpisodeAccumulator> groups = new LinkedHashMap<>();
        for (EpisodeClaim line : claimLines) {
            Baby baby = line.getBaby();
            HospitalStay stay = line.getStay();
            Claim claim = line.getClaim();
            EpisodeGroup group = new EpisodeGroup(
                new EpisodeKey(claim.getPatientId(), stay.getAdmitDate(), stay.getDischargeDate()),
                baby.getKey(), stay.getDeliveryDate(), stay.getLengthOfStay(), line.getStayType(),
                baby.getBirthType(), baby.getContract(), claim.getBusinessLine(), claim.getProductCode(),
                line.getStudyYear());
            groups.computeIfAbsent(group, g -> new EpisodeAccumulator())
                .add(claim.getPaidAmount(), baby.getBabyType());
        }

        List<Episode> episodes = new ArrayList<>();
        groups.forEach((group, acc) -> episodes.add(Episode.builder()
            .key(group.key())
            .babyKey(group.babyKey())
            .deliveryDate(group.deliveryDate())
            .lengthOfStay(group.lengthOfStay())
            .stayType(group.stayType())
            .birthType(group.birthType())
            .contract(group.contract())
            .businessLine(group.businessLine())
            .productCode(group.productCode())
            .studyYear(group.studyYear())
            .paidAmount(acc.paid)
            .babyType(BabyType.of(acc.anyNicu))
            .build()));
        episodes.sort(EPISODE_ORDER);
        return List.copyOf(episodes);
    }

    List<NewbornRecord> rollupNewborns(List<Episode> episodes) {
        Map<NewbornGroup, NewbornAccumulator> groups = new LinkedHashMap<>();
        for (Episode episode : episodes) {
            NewbornGroup group = new NewbornGroup(episode.getBabyKey(), episode.getDeliveryDate(),
                episode.getBusinessLine(), episode.getProductCode(), episode.getStudyYear());
            groups.computeIfAbsent(group, g -> new NewbornAccumulator()).add(episode);
        }

        List<NewbornRecord> newborns = new ArrayList<>();
        groups.forEach((group, acc) -> newborns.add(NewbornRecord.builder()
            .patientId(group.babyKey().patientId())
            .birthDate(group.babyKey().birthDate())
            .deliveryDate(group.deliveryDate())
            .businessLine(group.businessLine())
            .productCode(group.productCode())
            .studyYear(group.studyYear())
            .admitDate(acc.admit)
            .dischargeDate(acc.discharge)
            .paidAmount(acc.paid)
            .lengthOfStay(StayStitcher.lengthOfStay(acc.admit, acc.discharge))
            .babyType(BabyType.of(acc.anyNicu))
            .birthType(BirthType.fromPriority(acc.birthPriority))
            .contract(ContractType.of(acc.anyDrg))
            .build()));
        newborns.sort(NEWBORN_ORDER);
        return List.copyOf(newborns);
    }

    List<NicuClaim> nicuClaims(List<EpisodeClaim> claimLines, List<NicuRecord> nicuRecords) {
        Map<String, List<NicuRecord>> nicuByPatient = new HashMap<>();
        for (NicuRecord record : nicuRecords) {
            nicuByPatient.computeIfAbsent(record.getNewborn().getPatientId(), k -> new ArrayList<>()).add(record);
        }

        List<NicuClaim> nicuClaims = new ArrayList<>();
        for (EpisodeClaim line : claimLines) {
            Claim claim = line.getClaim();
            for (NicuRecord record : nicuByPatient.getOrDefault(claim.getPatientId(), List.of())) {
                EpisodeKey key = record.getKey();
                LocalDate serviceDate = claim.getServiceFromDate();
                if (!serviceDate.isBefore(key.admitDate()) && !serviceDate.isAfter(key.dischargeDate())) {
                    nicuClaims.add(new NicuClaim(key, claim, line.getStay().getLengthOfStay()));
                }
            }
        }
        return List.copyOf(nicuClaims);
    }

    private record StayPartition(BabyKey babyKey, LocalDate deliveryDate) {}

    private record ClaimLineKey(String patientId, LocalDate deliveryDate, String claimNumber) {}

    private record EpisodeGroup(
        EpisodeKey key,
        BabyKey babyKey,
        LocalDate deliveryDate,
        int lengthOfStay,
        StayType stayType,
        BirthType birthType,
        ContractType contract,
        String businessLine,
        String productCode,
        StudyYear studyYear
    ) {}

    private record NewbornGroup(
        BabyKey babyKey,
        LocalDate deliveryDate,
        String businessLine,
        String productCode,
        StudyYear studyYear
    ) {}

    private static final class EpisodeAccumulator {
        private BigDecimal paid = BigDecimal.ZERO;
        private boolean anyNicu;

        private void add(BigDecimal amount, BabyType babyType) {
            if (amount != null) {
                paid = paid.add(amount);
            }
            anyNicu |= babyType.isNicu();
        }
    }

    private static final class NewbornAccumulator {
        private LocalDate admit;
        private LocalDate discharge;
        private BigDecimal paid = BigDecimal.ZERO;
        private boolean anyNicu;
        private boolean anyDrg;
        private int birthPriority;

        private void add(Episode episode) {
            EpisodeKey key = episode.getKey();
            if (admit == null || key.admitDate().isBefore(admit)) {
                admit = key.admitDate();
            }
            if (discharge == null || key.dischargeDate().isAfter(discharge)) {
                discharge = key.dischargeDate();
            }
            paid = paid.add(episode.getPaidAmount());
            anyNicu |= episode.getBabyType().isNicu();
            anyDrg |= episode.getContract() == ContractType.DRG;
            birthPriority = Math.max(birthPriority, episode.getBirthType().getPriority());
        }
    }
}
