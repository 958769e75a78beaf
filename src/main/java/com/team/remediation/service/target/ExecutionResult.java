package com.team.remediation.service.target;

import java.time.Instant;

/**
 * Raw outcome of applying one action to the target system.
 */
public record ExecutionResult(boolean success, String output, Instant executedAt) {

    public static ExecutionResult success(String output, Instant at) {
        return new ExecutionResult(true, output, at);
    }

    public static ExecutionResult failure(String output, Instant at) {
        return new ExecutionResult(false, output, at);
    }
}
