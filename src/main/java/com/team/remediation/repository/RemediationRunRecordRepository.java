package com.team.remediation.repository;

import com.team.remediation.model.entity.RemediationRunRecord;
import com.team.remediation.model.workflow.RunStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface RemediationRunRecordRepository extends JpaRepository<RemediationRunRecord, Long> {

    Optional<RemediationRunRecord> findByRunId(String runId);

    List<RemediationRunRecord> findTop50ByOrderByStartedAtDesc();

    List<RemediationRunRecord> findByScopeOrderByStartedAtDesc(String scope);

    long countByStatus(RunStatus status);

    /** Runs per status since a point in time */
    @Query("SELECT r.status, COUNT(r) FROM RemediationRunRecord r WHERE r.startedAt >= :since GROUP BY r.status")
    List<Object[]> countByStatusSince(@Param("since") Instant since);
}
