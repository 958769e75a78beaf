package com.team.remediation.controller;

import com.team.remediation.model.dto.ActorRequest;
import com.team.remediation.model.dto.RunHistoryResponse;
import com.team.remediation.model.dto.StartWorkflowRequest;
import com.team.remediation.model.workflow.RunSummary;
import com.team.remediation.model.workflow.WorkflowRun;
import com.team.remediation.service.history.RunHistoryRecorder;
import com.team.remediation.service.workflow.WorkflowEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Remediation runs.
 *
 * - POST /api/v1/remediation/workflows               start a run for a scope (202)
 * - GET  /api/v1/remediation/workflows               runs of this process, newest first
 * - GET  /api/v1/remediation/workflows/{id}          one run
 * - POST /api/v1/remediation/workflows/{id}/cancel   cancel before execution
 * - GET  /api/v1/remediation/workflows/history?days= finished runs from the database
 */
@RestController
@RequestMapping("/api/v1/remediation/workflows")
@Slf4j
@RequiredArgsConstructor
public class WorkflowController {

    private final WorkflowEngine workflowEngine;
    private final RunHistoryRecorder historyRecorder;
    private final Clock clock;

    @PostMapping
    public ResponseEntity<RunSummary> start(@RequestBody StartWorkflowRequest request) {
        if (request.scope() == null || request.scope().isBlank()) {
            throw new IllegalArgumentException("scope is required");
        }
        log.info("Starting remediation run for scope {}", request.scope());
        WorkflowRun run = workflowEngine.start(request.scope());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(run.summary());
    }

    @GetMapping
    public ResponseEntity<List<RunSummary>> list() {
        return ResponseEntity.ok(workflowEngine.runs().stream().map(WorkflowRun::summary).toList());
    }

    @GetMapping("/history")
    public ResponseEntity<RunHistoryResponse> history(@RequestParam(defaultValue = "7") int days) {
        Instant since = clock.instant().minus(Duration.ofDays(days));
        return ResponseEntity.ok(new RunHistoryResponse(since, historyRecorder.countsByStatus(since),
                historyRecorder.recent()));
    }

    @GetMapping("/{runId}")
    public ResponseEntity<RunSummary> get(@PathVariable String runId) {
        return ResponseEntity.ok(workflowEngine.get(runId).summary());
    }

    @PostMapping("/{runId}/cancel")
    public ResponseEntity<RunSummary> cancel(@PathVariable String runId,
                                             @RequestBody(required = false) ActorRequest request) {
        String actor = request != null && request.actor() != null && !request.actor().isBlank()
                ? request.actor() : "api";
        return ResponseEntity.ok(workflowEngine.cancel(runId, actor));
    }
}
