package com.nicuanalytics.service;

import com.nicuanalytics.model.Claim;
import com.nicuanalytics.model.EpisodeKey;
import com.nicuanalytics.model.NicuClaim;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Rank (lower wins), on the trimmed code:
 *   0: 20 (expired)
 *   1: 07 (left against medical advice)
 *   2: 02, 05, 43, 62, 63, 65, 66 (transfers)
 *   3: 30 (still a patient)
 *   4: 01, 06 (home)
 *   6: shorter than two characters, unlisted, or inside a reserved range
 *   9: anything else
 * Reserved ranges compare as text, so "100" falls inside 08..19 and "9A" falls outside 71..99.
 * Ties fall to the latest discharge date, then latest service-from date, then the lowest code.
 */
@Service
public class DischargeStatusResolver {

    private static final Set<String> TRANSFER_CODES = Set.of("02", "05", "66", "43", "62", "63", "65");
    private static final Set<String> HOME_CODES = Set.of("01", "06");
    private static final Set<String> UNLISTED_CODES = Set.of("04", "41", "50", "51", "70", "03", "64");
    private static final String[][] RESERVED_RANGES = {
        {"08", "19"}, {"21", "29"}, {"31", "39"}, {"44", "49"}, {"52", "60"}, {"67", "69"}, {"71", "99"}
    };

    private static final Comparator<Claim> STATUS_ORDER = Comparator
        .comparingInt((Claim c) -> rank(c.getDischargeStatusCode()))
        .thenComparing(Claim::getDischargeDate, Comparator.nullsLast(Comparator.<LocalDate>reverseOrder()))
        .thenComparing(Claim::getServiceFromDate, Comparator.nullsLast(Comparator.<LocalDate>reverseOrder()))
        .thenComparing(c -> c.getDischargeStatusCode().trim());

    public Map<EpisodeKey, String> resolve(List<NicuClaim> nicuClaims) {
        Map<EpisodeKey, Claim> best = new TreeMap<>();
        for (NicuClaim nicuClaim : nicuClaims) {
            Claim claim = nicuClaim.getClaim();
            if (!isCandidate(claim.getDischargeStatusCode())) {
                continue;
            }
            best.merge(nicuClaim.getKey(), claim, (existing, candidate) ->
                STATUS_ORDER.compare(candidate, existing) < 0 ? candidate : existing);
        }
        Map<EpisodeKey, String> statuses = new TreeMap<>();
        best.forEach((key, claim) -> statuses.put(key, claim.getDischargeStatusCode().trim()));
        return statuses;
    }

    static boolean isCandidate(String code) {
        if (code == null || code.isBlank()) {
            return false;
        }
        return !code.trim().chars().allMatch(ch -> ch == '0');
    }

    static int rank(String rawCode) {
        String code = rawCode.trim();
        if ("20".equals(code)) return 0;
        if ("07".equals(code)) return 1;
        if (TRANSFER_CODES.contains(code)) return 2;
        if ("30".equals(code)) return 3;
        if (HOME_CODES.contains(code)) return 4;
        if (code.length() < 2 || UNLISTED_CODES.contains(code) || inReservedRange(code)) return 6;
        return 9;
    }

    private static boolean inReservedRange(String code) {
        for (String[] range : RESERVED_RANGES) {
            if (code.compareTo(range[0]) >= 0 && code.compareTo(range[1]) <= 0) {
                return true;
            }
        }
        return false;
    }
}
