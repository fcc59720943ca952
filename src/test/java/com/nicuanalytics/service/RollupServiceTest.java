package com.nicuanalytics.service;

import com.nicuanalytics.dto.RollupRequest;
import com.nicuanalytics.dto.RollupResponse;
import com.nicuanalytics.dto.RollupRunResponse;
import com.nicuanalytics.dto.RollupSummary;
import com.nicuanalytics.entity.RollupRunRecord;
import com.nicuanalytics.exception.MissingClaimFieldException;
import com.nicuanalytics.exception.RollupStageException;
import com.nicuanalytics.model.BabyType;
import com.nicuanalytics.model.BirthType;
import com.nicuanalytics.model.Claim;
import com.nicuanalytics.model.ContractType;
import com.nicuanalytics.model.NewbornRollupRecord;
import com.nicuanalytics.model.NicuRollupRecord;
import com.nicuanalytics.model.ReferenceCodeSets;
import com.nicuanalytics.model.RollupResult;
import com.nicuanalytics.model.RollupWindow;
import com.nicuanalytics.model.StudyYear;
import com.nicuanalytics.repository.RollupRunRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static com.nicuanalytics.ClaimFixtures.*;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RollupServiceTest {

    @Mock ClaimValidator        claimValidator;
    @Mock BirthWindowCalculator windowCalculator;
    @Mock ReferenceDataService  referenceDataService;
    @Mock NicuRollupPipeline    pipeline;
    @Mock RollupRunRepository   repository;
    @InjectMocks RollupService service;

    private List<Claim> claims;

    @BeforeEach
    void setUp() {
        claims = List.of(inpatient("P1", "C1", "2023-01-01", "2023-01-11").flags(NICU_DRG).build());
    }

    private static RollupResult twoNewborns() {
        NicuRollupRecord nicuRow = NicuRollupRecord.builder()
            .newborn(newborn("P1", "2023-01-01", "2023-01-11").build())
            .totalNicuCost(money("9600"))
            .readmissions(1)
            .lowPaidNicu(false)
            .inappropriateNicu(true)
            .build();
        NewbornRollupRecord nicu = NewbornRollupRecord.builder()
            .patientId("P1").studyYear(StudyYear.PREVIOUS).birthType(BirthType.SINGLE)
            .babyType(BabyType.NICU).contract(ContractType.DRG)
            .paidAmount(money("9600")).lengthOfStay(10).nicu(nicuRow).build();
        NewbornRollupRecord normal = NewbornRollupRecord.builder()
            .patientId("P2").studyYear(StudyYear.CURRENT).birthType(BirthType.TWIN)
            .babyType(BabyType.NORMAL_NEWBORN).contract(ContractType.PER_DIEM)
            .paidAmount(money("3000")).lengthOfStay(2).build();
        return RollupResult.builder()
            .window(WINDOW)
            .claimCount(4)
            .stays(List.of())
            .newborns(List.of())
            .nicuRecords(List.of(nicuRow))
            .records(List.of(nicu, normal))
            .build();
    }

    private void savesWithGeneratedId() {
        when(repository.save(any())).thenAnswer(inv -> {
            RollupRunRecord record = inv.getArgument(0);
            record.setId(UUID.randomUUID());
            record.setCreatedAt(Instant.now());
            return record;
        });
    }

    @Test
    void runRollup_derivesWindowWhenNoneGiven() {
        RollupRequest request = RollupRequest.builder().clientId("acme").claims(claims).build();
        when(windowCalculator.derive(claims)).thenReturn(WINDOW);
        when(referenceDataService.codeSets("req-1")).thenReturn(ReferenceCodeSets.EMPTY);
        when(pipeline.run(claims, WINDOW, ReferenceCodeSets.EMPTY)).thenReturn(twoNewborns());
        savesWithGeneratedId();

        RollupResponse response = service.runRollup(request, "req-1");

        assertThat(response.getRunId()).isNotNull();
        assertThat(response.getClientId()).isEqualTo("acme");
        assertThat(response.getBirthWindowStart()).isEqualTo(WINDOW.getBirthWindowStart());
        assertThat(response.getRecords()).hasSize(2);
        assertThat(response.getRequestId()).isEqualTo("req-1");
        verify(windowCalculator, never()).validate(any());
        verify(claimValidator).validate(claims);
    }

    @Test
    void runRollup_persistsSummaryCounts() {
        RollupRequest request = RollupRequest.builder().clientId("acme").claims(claims).build();
        when(windowCalculator.derive(claims)).thenReturn(WINDOW);
        when(referenceDataService.codeSets(anyString())).thenReturn(ReferenceCodeSets.EMPTY);
        when(pipeline.run(any(), any(), any())).thenReturn(twoNewborns());
        savesWithGeneratedId();

        service.runRollup(request, "req-2");

        ArgumentCaptor<RollupRunRecord> captor = ArgumentCaptor.forClass(RollupRunRecord.class);
        verify(repository).save(captor.capture());
        RollupRunRecord saved = captor.getValue();
        assertThat(saved.getClientId()).isEqualTo("acme");
        assertThat(saved.getClaimCount()).isEqualTo(4);
        assertThat(saved.getNewbornsTotal()).isEqualTo(2);
        assertThat(saved.getNewbornsPreviousPeriod()).isEqualTo(1);
        assertThat(saved.getNewbornsCurrentPeriod()).isEqualTo(1);
        assertThat(saved.getNewbornsSingleBirth()).isEqualTo(1);
        assertThat(saved.getNewbornsTwinBirth()).isEqualTo(1);
        assertThat(saved.getNicuCount()).isEqualTo(1);
        assertThat(saved.getNicuRatePct()).isEqualByComparingTo("50.00");
        assertThat(saved.getTotalPaid()).isEqualByComparingTo("12600");
        assertThat(saved.getTotalNicuCost()).isEqualByComparingTo("9600");
        assertThat(saved.getNicuReadmissions()).isEqualTo(1);
        assertThat(saved.getInappropriateNicu()).isEqualTo(1);
        assertThat(saved.getRequestId()).isEqualTo("req-2");
    }

    @Test
    void runRollup_validatesExplicitWindow() {
        RollupRequest request = RollupRequest.builder().clientId("acme").claims(claims)
            .birthWindowStart(date("2022-07-01")).birthWindowEnd(date("2024-06-30"))
            .runoutEnd(date("2024-09-30")).build();
        when(windowCalculator.validate(any())).thenReturn(WINDOW);
        when(referenceDataService.codeSets(anyString())).thenReturn(ReferenceCodeSets.EMPTY);
        when(pipeline.run(any(), any(), any())).thenReturn(RollupResult.empty(WINDOW, 1));
        savesWithGeneratedId();

        RollupResponse response = service.runRollup(request, "req-3");

        ArgumentCaptor<RollupWindow> captor = ArgumentCaptor.forClass(RollupWindow.class);
        verify(windowCalculator).validate(captor.capture());
        assertThat(captor.getValue().getBirthWindowMid()).isNull();
        assertThat(response.getSummary().getNewborns()).isZero();
        verify(windowCalculator, never()).derive(any());
    }

    @Test
    void runRollup_pipelineFailure_nothingPersisted() {
        RollupRequest request = RollupRequest.builder().clientId("acme").claims(claims).build();
        when(windowCalculator.derive(claims)).thenReturn(WINDOW);
        when(referenceDataService.codeSets(anyString())).thenReturn(ReferenceCodeSets.EMPTY);
        when(pipeline.run(any(), any(), any()))
            .thenThrow(new RollupStageException(NicuRollupPipeline.MERGE, new IllegalStateException("bad join")));

        assertThatThrownBy(() -> service.runRollup(request, "req-4"))
            .isInstanceOf(RollupStageException.class);
        verify(repository, never()).save(any());
    }

    @Test
    void runRollup_invalidClaim_stopsBeforeReferenceData() {
        RollupRequest request = RollupRequest.builder().clientId("acme").claims(claims).build();
        doThrow(new MissingClaimFieldException("paidAmount", "C1")).when(claimValidator).validate(claims);

        assertThatThrownBy(() -> service.runRollup(request, "req-5"))
            .isInstanceOf(MissingClaimFieldException.class);
        verifyNoInteractions(referenceDataService, pipeline, repository);
    }

    @Test
    void summarize_emptyResultHasZeroRate() {
        RollupSummary summary = RollupService.summarize(RollupResult.empty(WINDOW, 7));

        assertThat(summary.getClaimCount()).isEqualTo(7);
        assertThat(summary.getNewborns()).isZero();
        assertThat(summary.getNicuRatePct()).isEqualByComparingTo("0");
        assertThat(summary.getTotalPaid()).isEqualByComparingTo("0");
    }

    @Test
    void getHistory_mapsStoredRuns() {
        RollupRunRecord record = RollupRunRecord.builder()
            .id(UUID.randomUUID()).clientId("acme")
            .birthWindowStart(WINDOW.getBirthWindowStart()).birthWindowMid(WINDOW.getBirthWindowMid())
            .birthWindowEnd(WINDOW.getBirthWindowEnd()).runoutEnd(WINDOW.getRunoutEnd())
            .claimCount(10).newbornsTotal(3).nicuCount(1).nicuRatePct(money("33.33"))
            .totalPaid(money("15000")).totalNicuCost(money("9000"))
            .nicuReadmissions(0).lowPaidNicu(0).inappropriateNicu(0)
            .createdAt(Instant.now()).requestId("req-6").build();
        when(repository.findHistory(eq("acme"), any())).thenReturn(new PageImpl<>(List.of(record)));

        Page<RollupRunResponse> page = service.getHistory("acme", PageRequest.of(0, 20));

        assertThat(page.getContent()).singleElement().satisfies(run -> {
            assertThat(run.getRunId()).isEqualTo(record.getId());
            assertThat(run.getSummary().getNewborns()).isEqualTo(3);
            assertThat(run.getSummary().getNicuRatePct()).isEqualByComparingTo("33.33");
        });
    }
}
