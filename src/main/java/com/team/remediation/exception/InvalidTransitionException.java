package com.team.remediation.exception;

import com.team.remediation.model.approval.ApprovalStatus;
import lombok.Getter;

@Getter
public class InvalidTransitionException extends RuntimeException {

    private final String proposalId;
    private final ApprovalStatus from;
    private final ApprovalStatus to;

    public InvalidTransitionException(String proposalId, ApprovalStatus from, ApprovalStatus to) {
        super(String.format("Proposal %s cannot move from %s to %s", proposalId, from, to));
        this.proposalId = proposalId;
        this.from = from;
        this.to = to;
    }
}
