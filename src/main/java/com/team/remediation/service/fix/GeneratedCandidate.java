package com.team.remediation.service.fix;

import com.team.remediation.model.proposal.ProposedAction;
import com.team.remediation.model.proposal.RiskLevel;

/**
 * A fix candidate parsed from the generative backend's response.
 *
 * @param riskLevel null when the response did not state one
 */
public record GeneratedCandidate(String rootCause,
                                 String fixId,
                                 RiskLevel riskLevel,
                                 ProposedAction action,
                                 ProposedAction rollback,
                                 String rationale) {
}
