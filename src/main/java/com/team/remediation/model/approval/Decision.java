package com.team.remediation.model.approval;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * A reviewer's verdict on a pending proposal.
 */
public enum Decision {

    APPROVED(ApprovalStatus.APPROVED),
    REJECTED(ApprovalStatus.REJECTED),
    NEEDS_MORE_INFO(ApprovalStatus.NEEDS_MORE_INFO);

    private final ApprovalStatus targetStatus;

    Decision(ApprovalStatus targetStatus) {
        this.targetStatus = targetStatus;
    }

    public ApprovalStatus targetStatus() {
        return targetStatus;
    }

    @JsonValue
    public String wireName() {
        return targetStatus.wireName();
    }

    /**
     * Accepts "approved"/"approve", "rejected"/"reject" and "needs_more_info", any case.
     */
    @JsonCreator
    public static Decision fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Decision is required");
        }
        return switch (value.trim().toLowerCase().replace('-', '_')) {
            case "approved", "approve" -> APPROVED;
            case "rejected", "reject" -> REJECTED;
            case "needs_more_info", "more_info" -> NEEDS_MORE_INFO;
            default -> throw new IllegalArgumentException("Unknown decision: " + value);
        };
    }
}
