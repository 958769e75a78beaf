package com.team.remediation.service.history;

import com.team.remediation.model.approval.ApprovalStatus;
import com.team.remediation.model.entity.RemediationRunRecord;
import com.team.remediation.model.workflow.ProposalOutcome;
import com.team.remediation.model.workflow.RunStatus;
import com.team.remediation.model.workflow.RunSummary;
import com.team.remediation.repository.RemediationRunRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Persists finished runs. Recording is best-effort and never affects the run.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RunHistoryRecorder {

    private static final int MAX_SUMMARY_LENGTH = 4000;

    private final RemediationRunRecordRepository repository;

    @Transactional
    public void record(RunSummary run) {
        try {
            RemediationRunRecord record = repository.findByRunId(run.id())
                    .orElseGet(() -> RemediationRunRecord.builder().runId(run.id()).build());
            record.setScope(run.scope());
            record.setStatus(run.status());
            record.setStartedAt(run.startedAt());
            record.setFinishedAt(run.finishedAt());
            record.setProposalCount(run.proposalIds().size());
            record.setCompletedCount((int) run.count(ApprovalStatus.COMPLETED));
            record.setFailedCount((int) run.count(ApprovalStatus.FAILED));
            record.setManualInvestigationCount(run.manualInvestigation().size());
            record.setSummary(truncate(describe(run.outcomes())));

            repository.save(record);
            log.info("[{}] Recorded run history ({})", run.id(), run.status().wireName());
        } catch (Exception e) {
            log.warn("[{}] Recording run history failed (run not affected): {}", run.id(), e.getMessage());
        }
    }

    @Transactional(readOnly = true)
    public List<RemediationRunRecord> recent() {
        return repository.findTop50ByOrderByStartedAtDesc();
    }

    /**
     * Run counts per status since {@code since}, every status present.
     */
    @Transactional(readOnly = true)
    public Map<String, Long> countsByStatus(Instant since) {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (RunStatus status : RunStatus.values()) {
            counts.put(status.wireName(), 0L);
        }
        for (Object[] row : repository.countByStatusSince(since)) {
            counts.put(((RunStatus) row[0]).wireName(), ((Number) row[1]).longValue());
        }
        return counts;
    }

    private static String describe(List<ProposalOutcome> outcomes) {
        return outcomes.stream()
                .map(o -> String.format("%s %s/%s -> %s%s", o.proposalId(), o.entityId(), o.patternId(),
                        o.finalStatus().wireName(), o.rolledBack() ? " (rolled back)" : ""))
                .collect(Collectors.joining("\n"));
    }

    private static String truncate(String text) {
        return text.length() <= MAX_SUMMARY_LENGTH ? text : text.substring(0, MAX_SUMMARY_LENGTH - 3) + "...";
    }
}
