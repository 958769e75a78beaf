package com.team.remediation.model.approval;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Aggregate decision state of one workflow's proposals.
 *
 * @param allApproved  true when the workflow has records and every current one is approved (or past approval);
 *                     needs_more_info records already replaced by a resubmission are left out
 * @param anyRejected  true when at least one record was rejected
 * @param pendingCount records still in pending_review
 * @param needsMoreInfo records sent back for more information
 */
public record WorkflowApprovalStatus(@JsonProperty("all_approved") boolean allApproved,
                                     @JsonProperty("any_rejected") boolean anyRejected,
                                     @JsonProperty("pending_count") int pendingCount,
                                     @JsonProperty("needs_more_info_count") int needsMoreInfo,
                                     @JsonProperty("total") int total) {

    public static final WorkflowApprovalStatus EMPTY = new WorkflowApprovalStatus(false, false, 0, 0, 0);

    /**
     * No record of the workflow is waiting for a reviewer.
     */
    public boolean isDecided() {
        return total > 0 && pendingCount == 0;
    }
}
