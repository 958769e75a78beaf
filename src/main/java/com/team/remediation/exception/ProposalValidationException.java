package com.team.remediation.exception;

import lombok.Getter;

import java.util.List;

/**
 * A fix proposal is malformed and must not enter the approval queue.
 */
@Getter
public class ProposalValidationException extends RuntimeException {

    private final String proposalId;
    private final List<String> violations;

    public ProposalValidationException(String proposalId, List<String> violations) {
        super(String.format("Proposal %s is invalid: %s", proposalId, String.join("; ", violations)));
        this.proposalId = proposalId;
        this.violations = List.copyOf(violations);
    }
}
