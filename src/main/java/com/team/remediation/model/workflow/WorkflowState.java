package com.team.remediation.model.workflow;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Steps of a remediation run, in order. Only {@link #AWAIT_APPROVAL} suspends.
 */
public enum WorkflowState {
    IDENTIFY,
    DIAGNOSE,
    QUERY_KNOWLEDGE,
    GENERATE_FIXES,
    AWAIT_APPROVAL,
    EXECUTE,
    VALIDATE,
    LEARN,
    DONE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    /**
     * Cancellation is allowed until execution begins.
     */
    public boolean isCancellable() {
        return ordinal() < EXECUTE.ordinal();
    }
}
