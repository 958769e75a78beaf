package com.team.remediation.model.proposal;

import com.team.remediation.model.approval.ApprovalStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A candidate remediation for one entity. Owned by its workflow until submitted,
 * then by the approval queue until it reaches a terminal state.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class FixProposal {

    private String id;
    private String workflowId;
    private String entityId;

    /** Scope the entity belongs to, e.g. a namespace */
    private String scope;
    private String rootCause;
    private ProposedAction proposedAction;
    private RiskLevel riskLevel;
    private double confidence;
    private String rationale;
    private ProposedAction rollbackAction;
    private String patternId;

    /** Identity of the fix in the knowledge graph, e.g. "increase_memory_limit" */
    private String fixId;

    private ProposalSource source;

    @Builder.Default
    private ApprovalStatus status = ApprovalStatus.PROPOSED;

    private Instant createdAt;
}
