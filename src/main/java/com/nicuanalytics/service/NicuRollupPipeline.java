package com.nicuanalytics.service;

import com.nicuanalytics.exception.NicuAnalyticsException;
import com.nicuanalytics.exception.RollupStageException;
import com.nicuanalytics.model.BirthClassification;
import com.nicuanalytics.model.Claim;
import com.nicuanalytics.model.CodeFeatures;
import com.nicuanalytics.model.CostFeatures;
import com.nicuanalytics.model.EpisodeIdentification;
import com.nicuanalytics.model.EpisodeKey;
import com.nicuanalytics.model.HospitalStay;
import com.nicuanalytics.model.NewbornRollupRecord;
import com.nicuanalytics.model.NicuRollupRecord;
import com.nicuanalytics.model.ProviderAttribution;
import com.nicuanalytics.model.ReferenceCodeSets;
import com.nicuanalytics.model.RollupResult;
import com.nicuanalytics.model.RollupWindow;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

@Slf4j
@Service
@RequiredArgsConstructor
public class NicuRollupPipeline {

    static final String ASSIGN_CLAIM_TYPES = "assign-claim-types";
    static final String FILTER_WINDOW = "filter-window";
    static final String CLASSIFY_BIRTHS = "classify-births";
    static final String STITCH_STAYS = "stitch-stays";
    static final String BUILD_EPISODES = "build-episodes";
    static final String RESOLVE_DISCHARGE_STATUS = "resolve-discharge-status";
    static final String ATTRIBUTE_PROVIDERS = "attribute-providers";
    static final String EXTRACT_CODES = "extract-codes";
    static final String BUILD_COST_FEATURES = "build-cost-features";
    static final String MERGE = "merge";
    static final String EXPORT = "export";

    private final ClaimTypeAssigner claimTypeAssigner;
    private final ClaimWindowFilter claimWindowFilter;
    private final BirthClassifier birthClassifier;
    private final StayStitcher stayStitcher;
    private final EpisodeBuilder episodeBuilder;
    private final DischargeStatusResolver dischargeStatusResolver;
    private final ProviderAttributor providerAttributor;
    private final CodeFeatureExtractor codeFeatureExtractor;
    private final CostFeatureBuilder costFeatureBuilder;
    private final RollupMerger rollupMerger;

    public RollupResult run(List<Claim> claims, RollupWindow window, ReferenceCodeSets referenceCodes) {
        List<Claim> typed = runStage(ASSIGN_CLAIM_TYPES, () -> claimTypeAssigner.assign(claims));
        List<Claim> windowed = runStage(FILTER_WINDOW, () -> claimWindowFilter.filter(typed, window));

        BirthClassification births = runStage(CLASSIFY_BIRTHS, () -> birthClassifier.classify(windowed));
        if (births.isEmpty()) {
            log.warn("No newborns identified | claims={} | windowStart={} | windowEnd={}",
                windowed.size(), window.getBirthWindowStart(), window.getBirthWindowEnd());
            return RollupResult.empty(window, windowed.size());
        }

        List<HospitalStay> stays = runStage(STITCH_STAYS,
            () -> stayStitcher.stitch(births.getClaims(), window.getRunoutEnd()));
        EpisodeIdentification episodes = runStage(BUILD_EPISODES,
            () -> episodeBuilder.build(births.getClaims(), stays, window));
        if (episodes.getNewborns().isEmpty()) {
            log.warn("No newborn episodes survived the initial window | babies={} | stays={}",
                births.getBabies().size(), stays.size());
            return RollupResult.empty(window, windowed.size());
        }

        Map<EpisodeKey, String> statuses = runStage(RESOLVE_DISCHARGE_STATUS,
            () -> dischargeStatusResolver.resolve(episodes.getNicuClaims()));
        Map<EpisodeKey, ProviderAttribution> providers = runStage(ATTRIBUTE_PROVIDERS,
            () -> providerAttributor.attribute(episodes.getNicuClaims(), windowed));
        CodeFeatures codes = runStage(EXTRACT_CODES,
            () -> codeFeatureExtractor.extract(episodes.getNicuClaims()));
        CostFeatures costs = runStage(BUILD_COST_FEATURES,
            () -> costFeatureBuilder.build(episodes.getNicuRecords(), episodes.getNicuClaims(), stays, referenceCodes));

        List<NicuRollupRecord> nicuRows = runStage(MERGE,
            () -> rollupMerger.mergeNicu(episodes.getNicuRecords(), codes, costs, statuses, providers));
        List<NewbornRollupRecord> records = runStage(EXPORT,
            () -> rollupMerger.mergeExport(episodes.getNewborns(), nicuRows));

        return RollupResult.builder()
            .window(window)
            .claimCount(windowed.size())
            .stays(stays)
            .newborns(episodes.getNewborns())
            .nicuRecords(nicuRows)
            .records(records)
            .build();
    }

    <T> T runStage(String stage, Supplier<T> work) {
        log.debug("Stage started | stage={}", stage);
        long started = System.currentTimeMillis();
        try {
            T result = work.get();
            log.info("Stage completed | stage={} | elapsedMs={}", stage, System.currentTimeMillis() - started);
            return result;
        } catch (NicuAnalyticsException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            log.error("Stage failed | stage={} | error={}", stage, ex.getMessage(), ex);
            throw new RollupStageException(stage, ex);
        }
    }
}
