package com.team.remediation.model.approval;

/**
 * Why a workflow's open records are being closed, and where each open state goes.
 */
public enum CloseReason {

    /** Another proposal of the workflow was rejected */
    WORKFLOW_REJECTED("workflow rejected", ApprovalStatus.EXPIRED, ApprovalStatus.REJECTED),
    /** The run stopped waiting for decisions */
    APPROVAL_TIMEOUT("approval timeout", ApprovalStatus.EXPIRED, ApprovalStatus.EXPIRED),
    CANCELLED("cancelled", ApprovalStatus.REJECTED, ApprovalStatus.REJECTED),
    /** The run itself failed and will not act on its proposals */
    RUN_FAILED("run failed", ApprovalStatus.EXPIRED, ApprovalStatus.EXPIRED);

    private final String feedback;
    private final ApprovalStatus pendingTarget;
    private final ApprovalStatus approvedTarget;

    CloseReason(String feedback, ApprovalStatus pendingTarget, ApprovalStatus approvedTarget) {
        this.feedback = feedback;
        this.pendingTarget = pendingTarget;
        this.approvedTarget = approvedTarget;
    }

    public String feedback() {
        return feedback;
    }

    /**
     * Target state for a record in {@code current}, or null when the record stays as it is.
     */
    public ApprovalStatus targetFor(ApprovalStatus current) {
        return switch (current) {
            case PENDING_REVIEW -> pendingTarget;
            case APPROVED -> approvedTarget;
            default -> null;
        };
    }
}
