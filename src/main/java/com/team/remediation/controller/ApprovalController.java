package com.team.remediation.controller;

import com.team.remediation.model.approval.ApprovalRecord;
import com.team.remediation.model.approval.ApprovalStats;
import com.team.remediation.model.approval.Decision;
import com.team.remediation.model.approval.WorkflowApprovalStatus;
import com.team.remediation.model.dto.ActorRequest;
import com.team.remediation.model.dto.DecisionRequest;
import com.team.remediation.model.dto.SubmitProposalsRequest;
import com.team.remediation.service.approval.ApprovalQueue;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Review API of the approval queue.
 *
 * - POST /api/v1/remediation/approvals                             submit proposals
 * - GET  /api/v1/remediation/approvals/pending?scope=              pending records, most urgent first
 * - POST /api/v1/remediation/approvals/{proposalId}/decide         decide one proposal
 * - POST /api/v1/remediation/approvals/workflow/{id}/approve-all   batch approve
 * - POST /api/v1/remediation/approvals/workflow/{id}/reject-all    batch reject
 * - GET  /api/v1/remediation/approvals/workflow/{id}/status        aggregate status
 */
@RestController
@RequestMapping("/api/v1/remediation/approvals")
@Slf4j
@RequiredArgsConstructor
public class ApprovalController {

    private final ApprovalQueue approvalQueue;

    @PostMapping
    public ResponseEntity<Map<String, Object>> submit(@RequestBody SubmitProposalsRequest request) {
        if (request.proposals() == null || request.proposals().isEmpty()) {
            throw new IllegalArgumentException("proposals must not be empty");
        }
        List<ApprovalRecord> records = approvalQueue.submit(request.workflowId(), request.proposals());
        return ResponseEntity.ok(Map.of(
                "proposal_ids", records.stream().map(ApprovalRecord::proposalId).toList()));
    }

    @GetMapping("/pending")
    public ResponseEntity<List<ApprovalRecord>> pending(@RequestParam(required = false) String scope) {
        return ResponseEntity.ok(approvalQueue.pending(scope));
    }

    @PostMapping("/{proposalId}/decide")
    public ResponseEntity<ApprovalRecord> decide(@PathVariable String proposalId,
                                                 @RequestBody DecisionRequest request) {
        if (request.decision() == null) {
            throw new IllegalArgumentException("decision is required");
        }
        String actor = requireActor(request.actor());
        log.info("Decision {} on {} by {}", request.decision().wireName(), proposalId, actor);
        return ResponseEntity.ok(approvalQueue.decide(proposalId, request.decision(), actor, request.feedback()));
    }

    @GetMapping("/{proposalId}")
    public ResponseEntity<ApprovalRecord> get(@PathVariable String proposalId) {
        return ResponseEntity.ok(approvalQueue.get(proposalId));
    }

    @GetMapping("/workflow/{workflowId}")
    public ResponseEntity<List<ApprovalRecord>> records(@PathVariable String workflowId) {
        return ResponseEntity.ok(approvalQueue.records(workflowId));
    }

    @GetMapping("/workflow/{workflowId}/status")
    public ResponseEntity<WorkflowApprovalStatus> status(@PathVariable String workflowId) {
        return ResponseEntity.ok(approvalQueue.status(workflowId));
    }

    @PostMapping("/workflow/{workflowId}/approve-all")
    public ResponseEntity<List<ApprovalRecord>> approveAll(@PathVariable String workflowId,
                                                           @RequestBody ActorRequest request) {
        return ResponseEntity.ok(approvalQueue.decideBatch(workflowId, Decision.APPROVED,
                requireActor(request.actor()), request.feedback()));
    }

    @PostMapping("/workflow/{workflowId}/reject-all")
    public ResponseEntity<List<ApprovalRecord>> rejectAll(@PathVariable String workflowId,
                                                          @RequestBody ActorRequest request) {
        return ResponseEntity.ok(approvalQueue.decideBatch(workflowId, Decision.REJECTED,
                requireActor(request.actor()), request.feedback()));
    }

    @GetMapping("/stats")
    public ResponseEntity<ApprovalStats> stats() {
        return ResponseEntity.ok(approvalQueue.stats());
    }

    private static String requireActor(String actor) {
        if (actor == null || actor.isBlank()) {
            throw new IllegalArgumentException("actor is required");
        }
        return actor;
    }
}
