package com.team.remediation.model.approval;

import java.time.Instant;

/**
 * One state change of an approval record: who moved it, when, to which state, and why.
 */
public record AuditEntry(ApprovalStatus from, ApprovalStatus to, String actor, Instant timestamp, String feedback) {
}
