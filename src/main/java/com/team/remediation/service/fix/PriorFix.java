package com.team.remediation.service.fix;

/**
 * A fix previously applied to a cause, read from its remediates edge.
 */
public record PriorFix(String fixNodeId, String label, long successCount, long attemptCount, String lastUsed) {

    public double successRate() {
        return attemptCount == 0 ? 0.0 : (double) successCount / attemptCount;
    }

    public String fixKey() {
        int colon = fixNodeId.indexOf(':');
        return colon >= 0 ? fixNodeId.substring(colon + 1) : fixNodeId;
    }
}
