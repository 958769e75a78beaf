package com.team.remediation.model.workflow;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Status of a run; everything except {@link #RUNNING} qualifies a finished run.
 */
public enum RunStatus {
    RUNNING,
    /** Every executed proposal completed */
    COMPLETED,
    /** Some executed proposals failed */
    PARTIAL_FAILURE,
    /** Every executed proposal failed */
    FAILED,
    /** A reviewer rejected a proposal; nothing was executed */
    REJECTED,
    /** No decision within the approval timeout */
    TIMEOUT,
    CANCELLED,
    /** Nothing to execute: no unhealthy entity, no known pattern, or no approved proposal */
    NO_ACTION,
    /** Unexpected failure of the run itself */
    ERROR;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    public boolean isFinished() {
        return this != RUNNING;
    }
}
