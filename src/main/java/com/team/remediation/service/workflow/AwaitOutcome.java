package com.team.remediation.service.workflow;

/**
 * Why the approval wait ended.
 */
public enum AwaitOutcome {
    /** Nothing is pending any more, or a proposal was rejected */
    DECIDED,
    TIMEOUT,
    CANCELLED
}
