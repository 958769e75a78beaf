package com.team.remediation.model.approval;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Event names on a workflow's approval stream.
 */
public enum ApprovalEventType {

    CONNECTED("connected"),
    SUBMITTED("submitted"),
    DECIDED("decided"),
    BATCH_APPROVED("batch_approved"),
    BATCH_REJECTED("batch_rejected"),
    BATCH_DECIDED("batch_decided"),
    EXPIRED("expired"),
    EXECUTION_UPDATED("execution_updated"),
    KEEP_ALIVE("keep_alive");

    private final String wireName;

    ApprovalEventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public static ApprovalEventType forBatch(Decision decision) {
        return switch (decision) {
            case APPROVED -> BATCH_APPROVED;
            case REJECTED -> BATCH_REJECTED;
            case NEEDS_MORE_INFO -> BATCH_DECIDED;
        };
    }
}
