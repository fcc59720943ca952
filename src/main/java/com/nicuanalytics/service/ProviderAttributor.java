package com.nicuanalytics.service;

import com.nicuanalytics.model.Claim;
import com.nicuanalytics.model.EpisodeKey;
import com.nicuanalytics.model.NicuClaim;
import com.nicuanalytics.model.ProviderAttribution;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Attributes each NICU episode to the provider that saw the baby last.
 *
 * Providers are ranked by their latest discharge, then their own length of stay, then their paid
 * amount. A provider whose last discharge is before the episode's discharge gets one extra day.
 */
@Slf4j
@Service
public class ProviderAttributor {

    static final String UNKNOWN = "Unknown";

    private static final Comparator<ProviderAttribution> BEST_PROVIDER = Comparator
        .comparing(ProviderAttribution::getDischargeDate, Comparator.reverseOrder())
        .thenComparing(ProviderAttribution::getLengthOfStay, Comparator.reverseOrder())
        .thenComparing(ProviderAttribution::getPaidAmount, Comparator.reverseOrder())
        .thenComparing(ProviderAttribution::getProviderId);

    public Map<EpisodeKey, ProviderAttribution> attribute(List<NicuClaim> nicuClaims, List<Claim> allClaims) {
        Map<EpisodeKey, Map<String, ProviderAccumulator>> byEpisode = new TreeMap<>();
        for (NicuClaim nicuClaim : nicuClaims) {
            Claim claim = nicuClaim.getClaim();
            if (claim.getProviderId() == null || claim.getProviderId().isBlank()) {
                continue;
            }
            byEpisode.computeIfAbsent(nicuClaim.getKey(), k -> new TreeMap<>())
                .computeIfAbsent(claim.getProviderId(), k -> new ProviderAccumulator())
                .add(claim);
        }
        if (byEpisode.isEmpty()) {
            return Map.of();
        }

        Map<String, ProviderDirectoryEntry> directory = providerDirectory(allClaims);
        Map<EpisodeKey, ProviderAttribution> attributions = new TreeMap<>();
        byEpisode.forEach((key, providers) -> {
            ProviderAttribution best = null;
            for (Map.Entry<String, ProviderAccumulator> entry : providers.entrySet()) {
                ProviderAttribution candidate = entry.getValue().toAttribution(
                    entry.getKey(), key, directory.get(entry.getKey()));
                if (best == null || BEST_PROVIDER.compare(candidate, best) < 0) {
                    best = candidate;
                }
            }
            attributions.put(key, best);
        });
        log.debug("Attributed providers | episodes={}", attributions.size());
        return attributions;
    }

    Map<String, ProviderDirectoryEntry> providerDirectory(List<Claim> claims) {
        Map<String, ProviderDirectoryEntry> directory = new HashMap<>();
        for (Claim claim : claims) {
            if (claim.getProviderId() == null) {
                continue;
            }
            ProviderDirectoryEntry entry = new ProviderDirectoryEntry(
                claim.getProviderTin(), claim.getProviderName(), claim.getProviderState());
            directory.merge(claim.getProviderId(), entry, ProviderDirectoryEntry::merge);
        }
        return directory;
    }

    record ProviderDirectoryEntry(String tin, String name, String state) {

        ProviderDirectoryEntry merge(ProviderDirectoryEntry other) {
            return new ProviderDirectoryEntry(lowest(tin, other.tin), lowest(name, other.name),
                lowest(state, other.state));
        }

        private static String lowest(String a, String b) {
            if (a == null) return b;
            if (b == null) return a;
            return a.compareTo(b) <= 0 ? a : b;
        }
    }

    private static final class ProviderAccumulator {
        private BigDecimal paid = BigDecimal.ZERO;
        private LocalDate admit;
        private LocalDate discharge;

        private void add(Claim claim) {
            if (claim.getPaidAmount() != null) {
                paid = paid.add(claim.getPaidAmount());
            }
            LocalDate claimAdmit = claim.getAdmitOrServiceFrom();
            LocalDate claimDischarge = claim.getDischargeOrServiceThru();
            if (admit == null || claimAdmit.isBefore(admit)) {
                admit = claimAdmit;
            }
            if (discharge == null || claimDischarge.isAfter(discharge)) {
                discharge = claimDischarge;
            }
        }

        private ProviderAttribution toAttribution(String providerId, EpisodeKey episode, ProviderDirectoryEntry entry) {
            long days = ChronoUnit.DAYS.between(admit, discharge);
            int lengthOfStay = (int) (discharge.equals(episode.dischargeDate()) ? days : days + 1);
            return ProviderAttribution.builder()
                .providerId(providerId)
                .providerTin(entry != null ? entry.tin() : null)
                .providerName(entry != null && entry.name() != null ? entry.name() : UNKNOWN)
                .providerState(entry != null && entry.state() != null ? entry.state() : UNKNOWN)
                .paidAmount(paid)
                .admitDate(admit)
                .dischargeDate(discharge)
                .lengthOfStay(lengthOfStay)
                .build();
        }
    }
}
