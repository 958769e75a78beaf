package com.team.remediation.service.learning;

import com.team.remediation.model.proposal.FixProposal;

import java.time.Instant;

/**
 * Result of one executed proposal, fed back into the knowledge graph and search index.
 */
public record RemediationOutcome(String patternId,
                                 FixProposal proposal,
                                 boolean success,
                                 String entityScope,
                                 String detail,
                                 Instant recordedAt) {
}
