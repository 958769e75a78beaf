package com.team.remediation.model.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import com.team.remediation.model.workflow.RunStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One finished remediation run.
 */
@Entity
@Table(name = "remediation_run")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RemediationRunRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true)
    private String runId;

    /** Namespace or other scope the run covered */
    private String scope;

    @Enumerated(EnumType.STRING)
    private RunStatus status;

    private Instant startedAt;

    private Instant finishedAt;

    private int proposalCount;

    private int completedCount;

    private int failedCount;

    /** Entities without a known pattern */
    private int manualInvestigationCount;

    /** Per-proposal outcome lines */
    @Column(length = 4000)
    private String summary;
}
