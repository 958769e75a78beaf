package com.team.remediation.service.fix;

import com.team.remediation.exception.ProposalValidationException;
import com.team.remediation.model.approval.ApprovalStatus;
import com.team.remediation.model.proposal.FixProposal;
import com.team.remediation.model.proposal.ProposedAction;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks that a proposal may enter the approval queue.
 */
@Component
public class ProposalValidator {

    public List<String> violations(FixProposal proposal) {
        List<String> violations = new ArrayList<>();
        if (proposal == null) {
            violations.add("proposal is missing");
            return violations;
        }
        if (isBlank(proposal.getId())) {
            violations.add("id is required");
        }
        if (isBlank(proposal.getWorkflowId())) {
            violations.add("workflow_id is required");
        }
        if (isBlank(proposal.getEntityId())) {
            violations.add("entity_id is required");
        }
        if (isBlank(proposal.getRootCause())) {
            violations.add("root_cause is required");
        }
        if (isMissing(proposal.getProposedAction())) {
            violations.add("proposed_action must contain a command");
        }
        if (isMissing(proposal.getRollbackAction())) {
            violations.add("rollback_action must contain a command");
        }
        if (proposal.getRiskLevel() == null) {
            violations.add("risk_level must be LOW, MEDIUM or HIGH");
        }
        double confidence = proposal.getConfidence();
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            violations.add("confidence must be within [0.0, 1.0], was " + confidence);
        }
        if (proposal.getStatus() != null && proposal.getStatus() != ApprovalStatus.PROPOSED) {
            violations.add("status must be proposed, was " + proposal.getStatus().wireName());
        }
        return violations;
    }

    public boolean isValid(FixProposal proposal) {
        return violations(proposal).isEmpty();
    }

    /**
     * @throws ProposalValidationException listing every violation
     */
    public void validate(FixProposal proposal) {
        List<String> violations = violations(proposal);
        if (!violations.isEmpty()) {
            throw new ProposalValidationException(proposal != null ? proposal.getId() : null, violations);
        }
    }

    private static boolean isMissing(ProposedAction action) {
        return action == null || action.isEmpty();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
