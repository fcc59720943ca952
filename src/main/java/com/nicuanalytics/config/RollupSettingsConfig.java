package com.nicuanalytics.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.util.List;
import java.util.Set;

@Slf4j
@Configuration
public class RollupSettingsConfig {

    @Value("${nicu.rollup.hospital-gap-days:4}")
    private int hospitalGapDays;

    @Value("${nicu.rollup.initial-window-days:4}")
    private int initialWindowDays;

    @Value("${nicu.rollup.readmission-window-days:30}")
    private int readmissionWindowDays;

    @Value("${nicu.rollup.long-stay-threshold-days:3}")
    private int longStayThresholdDays;

    @Value("${nicu.rollup.high-cost-ceiling:500000}")
    private BigDecimal highCostCeiling;

    @Value("${nicu.rollup.low-paid-nicu-threshold:150}")
    private BigDecimal lowPaidNicuThreshold;

    @Value("${nicu.rollup.inappropriate-nicu.max-los:5}")
    private int inappropriateNicuMaxLos;

    @Value("${nicu.rollup.inappropriate-nicu.revenue-codes:170,171}")
    private List<String> inappropriateNicuRevenueCodes;

    @Value("${nicu.rollup.manageable-cpts:99233,99479,99480,99478,99231,99232,99462}")
    private List<String> manageableCpts;

    @Value("${nicu.rollup.critical-care-cpts:99468,99469,99471,99472}")
    private List<String> criticalCareCpts;

    @Value("${nicu.rollup.room-board-prefixes:011,012,013,014,015,016,017,020}")
    private List<String> roomBoardPrefixes;

    @Value("${nicu.rollup.nicu-revenue-min:170}")
    private int nicuRevenueMin;

    @Value("${nicu.rollup.nicu-revenue-max:179}")
    private int nicuRevenueMax;

    @Value("${nicu.rollup.nicu-drg-ranges:580-640,789-795}")
    private List<String> nicuDrgRanges;

    @Value("${nicu.rollup.nas-diagnosis-code:P961}")
    private String nasDiagnosisCode;

    @Value("${nicu.rollup.min-history-months:24}")
    private int minHistoryMonths;

    @Value("${nicu.rollup.birth-window-months:24}")
    private int birthWindowMonths;

    @Value("${nicu.rollup.runout-window-months:3}")
    private int runoutWindowMonths;

    @Bean
    public RollupSettings rollupSettings() {
        RollupSettings.RollupSettingsBuilder builder = RollupSettings.builder()
            .hospitalGapDays(hospitalGapDays)
            .initialWindowDays(initialWindowDays)
            .readmissionWindowDays(readmissionWindowDays)
            .longStayThresholdDays(longStayThresholdDays)
            .highCostCeiling(highCostCeiling)
            .lowPaidNicuThreshold(lowPaidNicuThreshold)
            .inappropriateNicuMaxLos(inappropriateNicuMaxLos)
            .inappropriateNicuRevenueCodes(Set.copyOf(inappropriateNicuRevenueCodes))
            .manageableProcedureCodes(Set.copyOf(manageableCpts))
            .criticalCareProcedureCodes(Set.copyOf(criticalCareCpts))
            .roomAndBoardRevenuePrefixes(Set.copyOf(roomBoardPrefixes))
            .nicuRevenueMin(nicuRevenueMin)
            .nicuRevenueMax(nicuRevenueMax)
            .nasDiagnosisCode(nasDiagnosisCode)
            .minHistoryMonths(minHistoryMonths)
            .birthWindowMonths(birthWindowMonths)
            .runoutWindowMonths(runoutWindowMonths);
        nicuDrgRanges.stream()
            .map(RollupSettings.CodeRange::parse)
            .forEach(builder::nicuDrgRange);
        RollupSettings settings = builder.build();
        log.info("Rollup settings | gapDays={} | readmitDays={} | highCost={} | lowPaid={}",
            settings.getHospitalGapDays(), settings.getReadmissionWindowDays(),
            settings.getHighCostCeiling(), settings.getLowPaidNicuThreshold());
        return settings;
    }
}
