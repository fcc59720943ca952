package com.nicuanalytics.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Entity
@Table(
    name = "rollup_runs",
    indexes = {
        @Index(name = "idx_run_client",  columnList = "client_id"),
        @Index(name = "idx_run_created", columnList = "created_at"),
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RollupRunRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Column(name = "client_id", nullable = false, length = 100)
    private String clientId;

    @Column(name = "birth_window_start", nullable = false)
    private LocalDate birthWindowStart;

    @Column(name = "birth_window_mid", nullable = false)
    private LocalDate birthWindowMid;

    @Column(name = "birth_window_end", nullable = false)
    private LocalDate birthWindowEnd;

    @Column(name = "runout_end", nullable = false)
    private LocalDate runoutEnd;

    @Column(name = "claim_count")
    private int claimCount;

    @Column(name = "hospital_stays")
    private int hospitalStays;

    @Column(name = "newborns_total")
    private int newbornsTotal;

    @Column(name = "newborns_previous_period")
    private int newbornsPreviousPeriod;

    @Column(name = "newborns_current_period")
    private int newbornsCurrentPeriod;

    @Column(name = "newborns_single_birth")
    private int newbornsSingleBirth;

    @Column(name = "newborns_twin_birth")
    private int newbornsTwinBirth;

    @Column(name = "newborns_multiple_birth")
    private int newbornsMultipleBirth;

    @Column(name = "nicu_count")
    private int nicuCount;

    @Column(name = "nicu_rate_pct", precision = 5, scale = 2)
    private BigDecimal nicuRatePct;

    @Column(name = "total_paid", precision = 18, scale = 2)
    private BigDecimal totalPaid;

    @Column(name = "total_nicu_cost", precision = 18, scale = 2)
    private BigDecimal totalNicuCost;

    @Column(name = "nicu_readmissions")
    private int nicuReadmissions;

    @Column(name = "low_paid_nicu")
    private int lowPaidNicu;

    @Column(name = "inappropriate_nicu")
    private int inappropriateNicu;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @Column(name = "request_id", length = 64)
    private String requestId;
}
