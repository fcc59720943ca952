package com.nicuanalytics.service;

import com.nicuanalytics.config.RollupSettings;
import com.nicuanalytics.model.CodeFeatures;
import com.nicuanalytics.model.EpisodeKey;
import com.nicuanalytics.model.NicuClaim;
import com.nicuanalytics.model.RevenueCodeFeature;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.nicuanalytics.ClaimFixtures.*;
import static org.assertj.core.api.Assertions.*;

class CodeFeatureExtractorTest {

    private static final EpisodeKey KEY = new EpisodeKey("P1", date("2023-01-01"), date("2023-01-11"));

    private final CodeFeatureExtractor extractor = new CodeFeatureExtractor(RollupSettings.defaults());

    private NicuClaim revenue(String claimNumber, String code) {
        return new NicuClaim(KEY, inpatient("P1", claimNumber, "2023-01-01", "2023-01-11").revenueCode(code).build(), 10);
    }

    private NicuClaim drg(String claimNumber, String code) {
        return new NicuClaim(KEY, inpatient("P1", claimNumber, "2023-01-01", "2023-01-11").drgCode(code).build(), 10);
    }

    @Test
    void extract_lowestNicuLevelWithLeveling() {
        CodeFeatures features = extractor.extract(List.of(
            revenue("C1", "0174"), revenue("C2", "0171"), revenue("C3", "0250")));

        RevenueCodeFeature feature = features.getRevenueCodes().get(KEY);
        assertThat(feature.getFinalRevenueCode()).isEqualTo("171");
        assertThat(feature.isLeveling()).isTrue();
    }

    @Test
    void extract_singleLevelHasNoLeveling() {
        CodeFeatures features = extractor.extract(List.of(revenue("C1", "0172"), revenue("C2", "172")));

        RevenueCodeFeature feature = features.getRevenueCodes().get(KEY);
        assertThat(feature.getFinalRevenueCode()).isEqualTo("172");
        assertThat(feature.isLeveling()).isFalse();
    }

    @Test
    void extract_ignoresNonNumericCodes() {
        CodeFeatures features = extractor.extract(List.of(revenue("C1", "017X"), drg("C2", "N/A")));

        assertThat(features.getRevenueCodes()).isEmpty();
        assertThat(features.getDrgCodes()).isEmpty();
    }

    @Test
    void extract_lowestDrgInsideNicuRanges() {
        CodeFeatures features = extractor.extract(List.of(drg("C1", "790"), drg("C2", "612"), drg("C3", "999")));

        assertThat(features.getDrgCodes()).containsEntry(KEY, "612");
    }

    @Test
    void parseNumber_trimsAndRejectsGarbage() {
        assertThat(CodeFeatureExtractor.parseNumber(" 0174 ")).hasValue(174);
        assertThat(CodeFeatureExtractor.parseNumber("abc")).isEmpty();
        assertThat(CodeFeatureExtractor.parseNumber(null)).isEmpty();
    }
}
