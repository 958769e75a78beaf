package com.team.remediation.model.workflow;

import com.team.remediation.model.approval.ApprovalStatus;

import java.time.Instant;
import java.util.List;

/**
 * Read-only view of a run.
 *
 * @param manualInvestigation entities for which no known pattern matched
 */
public record RunSummary(String id,
                         String scope,
                         RunStatus status,
                         WorkflowState state,
                         Instant startedAt,
                         Instant finishedAt,
                         List<String> proposalIds,
                         List<ProposalOutcome> outcomes,
                         List<String> manualInvestigation,
                         List<String> errors) {

    public long count(ApprovalStatus status) {
        return outcomes.stream().filter(o -> o.finalStatus() == status).count();
    }
}
