package com.nicuanalytics.service;

import com.nicuanalytics.dto.RollupRequest;
import com.nicuanalytics.dto.RollupResponse;
import com.nicuanalytics.dto.RollupRunResponse;
import com.nicuanalytics.dto.RollupSummary;
import com.nicuanalytics.entity.RollupRunRecord;
import com.nicuanalytics.model.BirthType;
import com.nicuanalytics.model.NewbornRollupRecord;
import com.nicuanalytics.model.NicuRollupRecord;
import com.nicuanalytics.model.ReferenceCodeSets;
import com.nicuanalytics.model.RollupResult;
import com.nicuanalytics.model.RollupWindow;
import com.nicuanalytics.model.StudyYear;
import com.nicuanalytics.repository.RollupRunRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class RollupService {

    private final ClaimValidator        claimValidator;
    private final BirthWindowCalculator windowCalculator;
    private final ReferenceDataService  referenceDataService;
    private final NicuRollupPipeline    pipeline;
    private final RollupRunRepository   repository;

    @Transactional
    public RollupResponse runRollup(RollupRequest request, String requestId) {
        claimValidator.validate(request.getClaims());
        RollupWindow window = resolveWindow(request);
        ReferenceCodeSets referenceCodes = referenceDataService.codeSets(requestId);

        RollupResult result = pipeline.run(request.getClaims(), window, referenceCodes);
        RollupSummary summary = summarize(result);
        RollupRunRecord saved = repository.save(toRecord(request.getClientId(), window, summary, requestId));

        log.info("Rollup completed | client={} | runId={} | newborns={} | nicu={} | requestId={}",
            request.getClientId(), saved.getId(), summary.getNewborns(), summary.getNicuCount(), requestId);
        return RollupResponse.builder()
            .runId(saved.getId())
            .clientId(saved.getClientId())
            .birthWindowStart(window.getBirthWindowStart())
            .birthWindowMid(window.getBirthWindowMid())
            .birthWindowEnd(window.getBirthWindowEnd())
            .runoutEnd(window.getRunoutEnd())
            .summary(summary)
            .records(result.getRecords())
            .createdAt(saved.getCreatedAt() != null ? saved.getCreatedAt() : Instant.now())
            .requestId(requestId)
            .build();
    }

    @Transactional(readOnly = true)
    public Page<RollupRunResponse> getHistory(String clientId, Pageable pageable) {
        return repository.findHistory(clientId, pageable).map(this::toRunResponse);
    }

    RollupWindow resolveWindow(RollupRequest request) {
        if (!request.hasExplicitWindow()) {
            return windowCalculator.derive(request.getClaims());
        }
        return windowCalculator.validate(RollupWindow.builder()
            .birthWindowStart(request.getBirthWindowStart())
            .birthWindowMid(request.getBirthWindowMid())
            .birthWindowEnd(request.getBirthWindowEnd())
            .runoutEnd(request.getRunoutEnd())
            .build());
    }

    static RollupSummary summarize(RollupResult result) {
        List<NewbornRollupRecord> records = result.getRecords();
        List<NicuRollupRecord> nicuRows = result.getNicuRecords();

        BigDecimal totalPaid = records.stream()
            .map(NewbornRollupRecord::getPaidAmount)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal totalNicuCost = nicuRows.stream()
            .map(NicuRollupRecord::getTotalNicuCost)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal nicuRate = records.isEmpty()
            ? BigDecimal.ZERO
            : BigDecimal.valueOf(nicuRows.size() * 100L)
                .divide(BigDecimal.valueOf(records.size()), 2, RoundingMode.HALF_UP);

        return RollupSummary.builder()
            .claimCount(result.getClaimCount())
            .hospitalStays(result.getStays().size())
            .newborns(records.size())
            .newbornsPreviousPeriod((int) records.stream().filter(r -> r.getStudyYear() == StudyYear.PREVIOUS).count())
            .newbornsCurrentPeriod((int) records.stream().filter(r -> r.getStudyYear() == StudyYear.CURRENT).count())
            .singleBirths((int) records.stream().filter(r -> r.getBirthType() == BirthType.SINGLE).count())
            .twinBirths((int) records.stream().filter(r -> r.getBirthType() == BirthType.TWIN).count())
            .multipleBirths((int) records.stream().filter(r -> r.getBirthType() == BirthType.MULTIPLE).count())
            .nicuCount(nicuRows.size())
            .nicuRatePct(nicuRate)
            .totalPaid(totalPaid)
            .totalNicuCost(totalNicuCost)
            .nicuReadmissions(nicuRows.stream().mapToInt(NicuRollupRecord::getReadmissions).sum())
            .lowPaidNicu((int) nicuRows.stream().filter(NicuRollupRecord::isLowPaidNicu).count())
            .inappropriateNicu((int) nicuRows.stream().filter(NicuRollupRecord::isInappropriateNicu).count())
            .build();
    }

    private RollupRunRecord toRecord(String clientId, RollupWindow window, RollupSummary s, String requestId) {
        return RollupRunRecord.builder()
            .clientId(clientId)
            .birthWindowStart(window.getBirthWindowStart()).birthWindowMid(window.getBirthWindowMid())
            .birthWindowEnd(window.getBirthWindowEnd()).runoutEnd(window.getRunoutEnd())
            .claimCount(s.getClaimCount()).hospitalStays(s.getHospitalStays())
            .newbornsTotal(s.getNewborns())
            .newbornsPreviousPeriod(s.getNewbornsPreviousPeriod()).newbornsCurrentPeriod(s.getNewbornsCurrentPeriod())
            .newbornsSingleBirth(s.getSingleBirths()).newbornsTwinBirth(s.getTwinBirths())
            .newbornsMultipleBirth(s.getMultipleBirths())
            .nicuCount(s.getNicuCount()).nicuRatePct(s.getNicuRatePct())
            .totalPaid(s.getTotalPaid()).totalNicuCost(s.getTotalNicuCost())
            .nicuReadmissions(s.getNicuReadmissions())
            .lowPaidNicu(s.getLowPaidNicu()).inappropriateNicu(s.getInappropriateNicu())
            .requestId(requestId)
            .build();
    }

    private RollupRunResponse toRunResponse(RollupRunRecord r) {
        RollupSummary summary = RollupSummary.builder()
            .claimCount(r.getClaimCount()).hospitalStays(r.getHospitalStays())
            .newborns(r.getNewbornsTotal())
            .newbornsPreviousPeriod(r.getNewbornsPreviousPeriod()).newbornsCurrentPeriod(r.getNewbornsCurrentPeriod())
            .singleBirths(r.getNewbornsSingleBirth()).twinBirths(r.getNewbornsTwinBirth())
            .multipleBirths(r.getNewbornsMultipleBirth())
            .nicuCount(r.getNicuCount()).nicuRatePct(r.getNicuRatePct())
            .totalPaid(r.getTotalPaid()).totalNicuCost(r.getTotalNicuCost())
            .nicuReadmissions(r.getNicuReadmissions())
            .lowPaidNicu(r.getLowPaidNicu()).inappropriateNicu(r.getInappropriateNicu())
            .build();
        return RollupRunResponse.builder()
            .runId(r.getId()).clientId(r.getClientId())
            .birthWindowStart(r.getBirthWindowStart()).birthWindowMid(r.getBirthWindowMid())
            .birthWindowEnd(r.getBirthWindowEnd()).runoutEnd(r.getRunoutEnd())
            .summary(summary)
            .createdAt(r.getCreatedAt())
            .requestId(r.getRequestId())
            .build();
    }
}
