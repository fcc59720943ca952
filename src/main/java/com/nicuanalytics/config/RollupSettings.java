package com.nicuanalytics.config;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.Set;

@Value
@Builder(toBuilder = true)
public class RollupSettings {

    @Builder.Default
    int hospitalGapDays = 4;

    @Builder.Default
    int initialWindowDays = 4;

    @Builder.Default
    int readmissionWindowDays = 30;

    @Builder.Default
    int longStayThresholdDays = 3;

    @Builder.Default
    BigDecimal highCostCeiling = new BigDecimal("500000");

    @Builder.Default
    BigDecimal lowPaidNicuThreshold = new BigDecimal("150");

    @Builder.Default
    int inappropriateNicuMaxLos = 5;

    @Builder.Default
    Set<String> inappropriateNicuRevenueCodes = Set.of("170", "171");

    @Builder.Default
    Set<String> manageableProcedureCodes = Set.of(
        "99233", "99479", "99480", "99478", "99231", "99232", "99462");

    @Builder.Default
    Set<String> criticalCareProcedureCodes = Set.of("99468", "99469", "99471", "99472");

    @Builder.Default
    Set<String> roomAndBoardRevenuePrefixes = Set.of(
        "011", "012", "013", "014", "015", "016", "017", "020");

    @Builder.Default
    int nicuRevenueMin = 170;

    @Builder.Default
    int nicuRevenueMax = 179;

    @Singular
    List<CodeRange> nicuDrgRanges;

    @Builder.Default
    String nasDiagnosisCode = "P961";

    @Builder.Default
    int minHistoryMonths = 24;

    @Builder.Default
    int birthWindowMonths = 24;

    @Builder.Default
    int runoutWindowMonths = 3;

    public static RollupSettings defaults() {
        return RollupSettings.builder()
            .nicuDrgRange(new CodeRange(580, 640))
            .nicuDrgRange(new CodeRange(789, 795))
            .build();
    }

    public boolean isNicuDrg(int drg) {
        return nicuDrgRanges.stream().anyMatch(range -> range.contains(drg));
    }

    public record CodeRange(int min, int max) {

        public boolean contains(int value) {
            return value >= min && value <= max;
        }

        public static CodeRange parse(String text) {
            String[] bounds = text.trim().split("-");
            if (bounds.length != 2) {
                throw new IllegalArgumentException("Code range must look like 'min-max': " + text);
            }
            return new CodeRange(Integer.parseInt(bounds[0].trim()), Integer.parseInt(bounds[1].trim()));
        }
    }
}
