package com.nicuanalytics.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class RollupSettingsConfigTest {

    private final RollupSettingsConfig config = new RollupSettingsConfig();
    private final List<String> revenueCodes = new ArrayList<>(List.of("170", "171"));

    @BeforeEach
    void setUp() {
        ReflectionTestUtils.setField(config, "hospitalGapDays", 4);
        ReflectionTestUtils.setField(config, "initialWindowDays", 4);
        ReflectionTestUtils.setField(config, "readmissionWindowDays", 30);
        ReflectionTestUtils.setField(config, "longStayThresholdDays", 3);
        ReflectionTestUtils.setField(config, "highCostCeiling", new BigDecimal("500000"));
        ReflectionTestUtils.setField(config, "lowPaidNicuThreshold", new BigDecimal("150"));
        ReflectionTestUtils.setField(config, "inappropriateNicuMaxLos", 5);
        ReflectionTestUtils.setField(config, "inappropriateNicuRevenueCodes", revenueCodes);
        ReflectionTestUtils.setField(config, "manageableCpts", List.of("99233", "99233"));
        ReflectionTestUtils.setField(config, "criticalCareCpts", List.of("99468"));
        ReflectionTestUtils.setField(config, "roomBoardPrefixes", List.of("011", "017"));
        ReflectionTestUtils.setField(config, "nicuRevenueMin", 170);
        ReflectionTestUtils.setField(config, "nicuRevenueMax", 179);
        ReflectionTestUtils.setField(config, "nicuDrgRanges", List.of("580-640", "789-795"));
        ReflectionTestUtils.setField(config, "nasDiagnosisCode", "P961");
        ReflectionTestUtils.setField(config, "minHistoryMonths", 24);
        ReflectionTestUtils.setField(config, "birthWindowMonths", 24);
        ReflectionTestUtils.setField(config, "runoutWindowMonths", 3);
    }

    @Test
    void rollupSettings_codeSetsAreImmutableCopies() {
        RollupSettings settings = config.rollupSettings();
        revenueCodes.add("172");

        assertThat(settings.getInappropriateNicuRevenueCodes()).containsExactlyInAnyOrder("170", "171");
        assertThat(settings.getManageableProcedureCodes()).containsExactly("99233");
        assertThatThrownBy(() -> settings.getCriticalCareProcedureCodes().add("99469"))
            .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> settings.getRoomAndBoardRevenuePrefixes().clear())
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void rollupSettings_parsesDrgRanges() {
        RollupSettings settings = config.rollupSettings();

        assertThat(settings.isNicuDrg(790)).isTrue();
        assertThat(settings.isNicuDrg(700)).isFalse();
    }
}
