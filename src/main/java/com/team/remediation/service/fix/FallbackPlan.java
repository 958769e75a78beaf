package com.team.remediation.service.fix;

import com.team.remediation.model.proposal.ProposedAction;
import com.team.remediation.model.proposal.RiskLevel;

/**
 * A concrete remediation derived from the static rule table for one entity.
 */
public record FallbackPlan(String patternId,
                           String fixId,
                           String fixLabel,
                           RiskLevel riskLevel,
                           double confidence,
                           String rootCause,
                           ProposedAction action,
                           ProposedAction rollback) {
}
