package com.nicuanalytics.service;

import com.nicuanalytics.config.RollupSettings;
import com.nicuanalytics.model.CodeFeatures;
import com.nicuanalytics.model.EpisodeKey;
import com.nicuanalytics.model.NicuClaim;
import com.nicuanalytics.model.RevenueCodeFeature;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.TreeMap;
import java.util.TreeSet;

@Service
@RequiredArgsConstructor
public class CodeFeatureExtractor {

    private final RollupSettings settings;

    public CodeFeatures extract(List<NicuClaim> nicuClaims) {
        Map<EpisodeKey, TreeSet<Integer>> revenueLevels = new TreeMap<>();
        Map<EpisodeKey, TreeSet<Integer>> drgs = new TreeMap<>();
        for (NicuClaim nicuClaim : nicuClaims) {
            parseNumber(nicuClaim.getClaim().getRevenueCode())
                .ifPresent(code -> {
                    if (code >= settings.getNicuRevenueMin() && code <= settings.getNicuRevenueMax()) {
                        revenueLevels.computeIfAbsent(nicuClaim.getKey(), k -> new TreeSet<>()).add(code);
                    }
                });
            parseNumber(nicuClaim.getClaim().getDrgCode())
                .ifPresent(code -> {
                    if (settings.isNicuDrg(code)) {
                        drgs.computeIfAbsent(nicuClaim.getKey(), k -> new TreeSet<>()).add(code);
                    }
                });
        }

        Map<EpisodeKey, RevenueCodeFeature> revenueCodes = new TreeMap<>();
        revenueLevels.forEach((key, levels) -> revenueCodes.put(key,
            new RevenueCodeFeature(Integer.toString(levels.first()), levels.size() > 1)));
        Map<EpisodeKey, String> drgCodes = new TreeMap<>();
        drgs.forEach((key, codes) -> drgCodes.put(key, Integer.toString(codes.first())));
        return new CodeFeatures(revenueCodes, drgCodes);
    }

    static OptionalInt parseNumber(String code) {
        if (code == null || code.isBlank()) {
            return OptionalInt.empty();
        }
        try {
            return OptionalInt.of(Integer.parseInt(code.trim()));
        } catch (NumberFormatException e) {
            return OptionalInt.empty();
        }
    }
}
