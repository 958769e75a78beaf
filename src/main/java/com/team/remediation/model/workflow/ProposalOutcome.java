package com.team.remediation.model.workflow;

import com.team.remediation.model.approval.ApprovalStatus;

/**
 * Final per-proposal result listed in a run summary.
 *
 * @param rolledBack whether the rollback action was applied after a failed execution
 */
public record ProposalOutcome(String proposalId,
                              String entityId,
                              String patternId,
                              ApprovalStatus finalStatus,
                              boolean rolledBack,
                              String detail) {

    public boolean executed() {
        return finalStatus == ApprovalStatus.COMPLETED || finalStatus == ApprovalStatus.FAILED;
    }
}
