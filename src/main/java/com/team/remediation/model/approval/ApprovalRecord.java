package com.team.remediation.model.approval;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.team.remediation.exception.InvalidTransitionException;
import com.team.remediation.model.proposal.FixProposal;
import com.team.remediation.model.proposal.RiskLevel;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Immutable review state of one proposal. Every change produces a new record with one more audit entry.
 */
public record ApprovalRecord(FixProposal proposal,
                             ApprovalStatus status,
                             String decidedBy,
                             Instant decidedAt,
                             String feedback,
                             Instant createdAt,
                             Instant expiresAt,
                             List<AuditEntry> auditTrail) {

    /**
     * Presentation order: highest risk first, then lowest confidence, then oldest.
     */
    public static final Comparator<ApprovalRecord> PRESENTATION_ORDER =
            Comparator.comparing((ApprovalRecord r) -> r.riskLevel() == null ? 0 : r.riskLevel().ordinal())
                    .reversed()
                    .thenComparingDouble(r -> r.proposal().getConfidence())
                    .thenComparing(ApprovalRecord::createdAt, Comparator.nullsLast(Comparator.naturalOrder()))
                    .thenComparing(ApprovalRecord::proposalId);

    public ApprovalRecord {
        auditTrail = auditTrail == null ? List.of() : List.copyOf(auditTrail);
    }

    /**
     * A freshly submitted record in pending_review.
     */
    public static ApprovalRecord pending(FixProposal proposal, String actor, Instant now, Instant expiresAt) {
        FixProposal copy = proposal.toBuilder().status(ApprovalStatus.PENDING_REVIEW).build();
        AuditEntry entry = new AuditEntry(ApprovalStatus.PROPOSED, ApprovalStatus.PENDING_REVIEW, actor, now, null);
        return new ApprovalRecord(copy, ApprovalStatus.PENDING_REVIEW, null, null, null, now, expiresAt, List.of(entry));
    }

    /**
     * Move to {@code next}, appending an audit entry.
     *
     * @param newExpiresAt expiry of the new state, or null to keep the current one
     * @throws InvalidTransitionException when the state machine forbids the move
     */
    public ApprovalRecord transition(ApprovalStatus next, String actor, Instant at, String note, Instant newExpiresAt) {
        if (!status.canTransitionTo(next)) {
            throw new InvalidTransitionException(proposalId(), status, next);
        }
        List<AuditEntry> trail = new ArrayList<>(auditTrail);
        trail.add(new AuditEntry(status, next, actor, at, note));

        boolean reviewDecision = status == ApprovalStatus.PENDING_REVIEW;
        return new ApprovalRecord(
                proposal.toBuilder().status(next).build(),
                next,
                reviewDecision ? actor : decidedBy,
                reviewDecision ? at : decidedAt,
                note != null ? note : feedback,
                createdAt,
                newExpiresAt != null ? newExpiresAt : expiresAt,
                trail);
    }

    @JsonIgnore
    public String proposalId() {
        return proposal.getId();
    }

    @JsonIgnore
    public String workflowId() {
        return proposal.getWorkflowId();
    }

    @JsonIgnore
    public RiskLevel riskLevel() {
        return proposal.getRiskLevel();
    }

    /**
     * Whether the time-based expiry applies at {@code now}.
     */
    public boolean isExpiredAt(Instant now) {
        return (status == ApprovalStatus.PENDING_REVIEW || status == ApprovalStatus.APPROVED)
                && expiresAt != null && !now.isBefore(expiresAt);
    }
}
