package com.team.remediation.model.approval;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a proposal under review:
 * proposed -> pending_review -> approved | rejected | needs_more_info,
 * approved -> executing -> completed | failed, plus expiry of pending_review and approved records.
 */
public enum ApprovalStatus {

    PROPOSED("proposed"),
    PENDING_REVIEW("pending_review"),
    APPROVED("approved"),
    REJECTED("rejected"),
    NEEDS_MORE_INFO("needs_more_info"),
    EXECUTING("executing"),
    COMPLETED("completed"),
    FAILED("failed"),
    EXPIRED("expired");

    private final String wireName;

    ApprovalStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Allowed successor states. Approved may still be rejected when its workflow is cancelled
     * or closed by another rejection.
     */
    public Set<ApprovalStatus> successors() {
        return switch (this) {
            case PROPOSED -> EnumSet.of(PENDING_REVIEW);
            case PENDING_REVIEW -> EnumSet.of(APPROVED, REJECTED, NEEDS_MORE_INFO, EXPIRED);
            case APPROVED -> EnumSet.of(EXECUTING, REJECTED, EXPIRED);
            case EXECUTING -> EnumSet.of(COMPLETED, FAILED);
            case REJECTED, NEEDS_MORE_INFO, COMPLETED, FAILED, EXPIRED -> EnumSet.noneOf(ApprovalStatus.class);
        };
    }

    public boolean canTransitionTo(ApprovalStatus next) {
        return successors().contains(next);
    }

    public boolean isTerminal() {
        return successors().isEmpty();
    }

    @JsonCreator
    public static ApprovalStatus fromValue(String value) {
        for (ApprovalStatus status : values()) {
            if (status.wireName.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown approval status: " + value);
    }
}
