package com.team.remediation.model.dto;

import com.team.remediation.model.proposal.FixProposal;

import java.util.List;

/**
 * Body of POST /api/v1/remediation/approvals.
 */
public record SubmitProposalsRequest(String workflowId, List<FixProposal> proposals) {
}
