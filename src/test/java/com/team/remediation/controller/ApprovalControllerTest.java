package com.team.remediation.controller;

import com.team.remediation.exception.ApprovalNotFoundException;
import com.team.remediation.exception.InvalidTransitionException;
import com.team.remediation.exception.ProposalValidationException;
import com.team.remediation.model.approval.ApprovalRecord;
import com.team.remediation.model.approval.ApprovalStatus;
import com.team.remediation.model.approval.Decision;
import com.team.remediation.model.approval.WorkflowApprovalStatus;
import com.team.remediation.model.proposal.FixProposal;
import com.team.remediation.model.proposal.ProposalSource;
import com.team.remediation.model.proposal.ProposedAction;
import com.team.remediation.model.proposal.RiskLevel;
import com.team.remediation.service.approval.ApprovalQueue;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ApprovalController.class)
class ApprovalControllerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ApprovalQueue approvalQueue;

    private static ApprovalRecord pendingRecord() {
        FixProposal proposal = FixProposal.builder()
                .id("fp-1")
                .workflowId("wf-1")
                .entityId("api-1")
                .scope("payments")
                .rootCause("memory limit too low")
                .proposedAction(ProposedAction.of("raise", "kubectl", "set", "resources", "deployment/api"))
                .rollbackAction(ProposedAction.of("restore", "kubectl", "set", "resources", "deployment/api"))
                .riskLevel(RiskLevel.LOW)
                .confidence(0.7)
                .patternId("resource_exhaustion")
                .source(ProposalSource.FALLBACK)
                .build();
        return ApprovalRecord.pending(proposal, ApprovalQueue.SYSTEM_ACTOR, NOW, NOW.plusSeconds(3600));
    }

    @Test
    void pendingListsRecordsInSnakeCase() throws Exception {
        when(approvalQueue.pending("payments")).thenReturn(List.of(pendingRecord()));

        mockMvc.perform(get("/api/v1/remediation/approvals/pending").param("scope", "payments"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].status").value("pending_review"))
                .andExpect(jsonPath("$[0].proposal.entity_id").value("api-1"))
                .andExpect(jsonPath("$[0].proposal.risk_level").value("LOW"))
                .andExpect(jsonPath("$[0].audit_trail.length()").value(1));
    }

    @Test
    void decideAcceptsVerbForm() throws Exception {
        ApprovalRecord approved = pendingRecord().transition(ApprovalStatus.APPROVED, "alice", NOW, "ok", null);
        when(approvalQueue.decide("fp-1", Decision.APPROVED, "alice", "ok")).thenReturn(approved);

        mockMvc.perform(post("/api/v1/remediation/approvals/fp-1/decide")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"decision\": \"approve\", \"actor\": \"alice\", \"feedback\": \"ok\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("approved"))
                .andExpect(jsonPath("$.decided_by").value("alice"));
    }

    @Test
    void decideWithoutActorIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/remediation/approvals/fp-1/decide")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"decision\": \"approved\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("bad_request"))
                .andExpect(jsonPath("$.message").value("actor is required"));
        verify(approvalQueue, never()).decide(any(), any(), any(), any());
    }

    @Test
    void unknownDecisionIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/remediation/approvals/fp-1/decide")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"decision\": \"maybe\", \"actor\": \"alice\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("bad_request"));
    }

    @Test
    void secondDecisionIsConflict() throws Exception {
        when(approvalQueue.decide(eq("fp-1"), eq(Decision.REJECTED), eq("bob"), isNull()))
                .thenThrow(new InvalidTransitionException("fp-1", ApprovalStatus.APPROVED, ApprovalStatus.REJECTED));

        mockMvc.perform(post("/api/v1/remediation/approvals/fp-1/decide")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"decision\": \"rejected\", \"actor\": \"bob\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("invalid_transition"));
    }

    @Test
    void unknownProposalIsNotFound() throws Exception {
        when(approvalQueue.get("nope")).thenThrow(new ApprovalNotFoundException("Proposal not found: nope"));

        mockMvc.perform(get("/api/v1/remediation/approvals/nope"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("not_found"));
    }

    @Test
    void submitReturnsProposalIds() throws Exception {
        when(approvalQueue.submit(eq("wf-1"), anyList())).thenReturn(List.of(pendingRecord()));

        mockMvc.perform(post("/api/v1/remediation/approvals")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"workflow_id": "wf-1", "proposals": [{
                                  "id": "fp-1", "entity_id": "api-1", "root_cause": "memory limit too low",
                                  "proposed_action": {"command": ["kubectl", "rollout", "restart", "deployment/api"]},
                                  "rollback_action": {"command": ["kubectl", "rollout", "undo", "deployment/api"]},
                                  "risk_level": "low", "confidence": 0.6}]}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.proposal_ids[0]").value("fp-1"));
    }

    @Test
    void invalidSubmissionListsViolations() throws Exception {
        when(approvalQueue.submit(eq("wf-1"), anyList()))
                .thenThrow(new ProposalValidationException("fp-1", List.of("root_cause is required")));

        mockMvc.perform(post("/api/v1/remediation/approvals")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"workflow_id\": \"wf-1\", \"proposals\": [{\"id\": \"fp-1\"}]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("validation_error"))
                .andExpect(jsonPath("$.violations[0]").value("root_cause is required"));
    }

    @Test
    void emptySubmissionIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/remediation/approvals")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"workflow_id\": \"wf-1\", \"proposals\": []}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void approveAllDecidesBatch() throws Exception {
        when(approvalQueue.decideBatch("wf-1", Decision.APPROVED, "alice", null)).thenReturn(List.of());

        mockMvc.perform(post("/api/v1/remediation/approvals/workflow/wf-1/approve-all")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"actor\": \"alice\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(0));
        verify(approvalQueue).decideBatch("wf-1", Decision.APPROVED, "alice", null);
    }

    @Test
    void statusUsesExplicitFieldNames() throws Exception {
        when(approvalQueue.status("wf-1")).thenReturn(new WorkflowApprovalStatus(true, false, 0, 0, 3));

        mockMvc.perform(get("/api/v1/remediation/approvals/workflow/wf-1/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.all_approved").value(true))
                .andExpect(jsonPath("$.any_rejected").value(false))
                .andExpect(jsonPath("$.pending_count").value(0))
                .andExpect(jsonPath("$.total").value(3));
    }
}
