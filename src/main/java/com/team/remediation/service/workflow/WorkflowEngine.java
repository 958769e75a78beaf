package com.team.remediation.service.workflow;

import com.team.remediation.config.RemediationConfig;
import com.team.remediation.exception.InvalidTransitionException;
import com.team.remediation.exception.ProposalValidationException;
import com.team.remediation.model.approval.ApprovalRecord;
import com.team.remediation.model.approval.ApprovalStatus;
import com.team.remediation.model.approval.CloseReason;
import com.team.remediation.model.diagnosis.AffectedEntity;
import com.team.remediation.model.diagnosis.Diagnosis;
import com.team.remediation.model.graph.Finding;
import com.team.remediation.model.graph.NodeType;
import com.team.remediation.model.proposal.FixProposal;
import com.team.remediation.model.proposal.ProposedAction;
import com.team.remediation.model.workflow.ProposalOutcome;
import com.team.remediation.model.workflow.RunStatus;
import com.team.remediation.model.workflow.RunSummary;
import com.team.remediation.model.workflow.WorkflowRun;
import com.team.remediation.model.workflow.WorkflowState;
import com.team.remediation.service.approval.ApprovalQueue;
import com.team.remediation.service.diagnosis.DiagnosisService;
import com.team.remediation.service.fix.FixGenerator;
import com.team.remediation.service.graph.KnowledgeGraph;
import com.team.remediation.service.history.RunHistoryRecorder;
import com.team.remediation.service.learning.LearningStore;
import com.team.remediation.service.learning.RemediationOutcome;
import com.team.remediation.service.notification.TeamsNotificationService;
import com.team.remediation.service.target.ExecutionResult;
import com.team.remediation.service.target.HealthCheckResult;
import com.team.remediation.service.target.TargetSystemClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * Drives remediation runs through
 * identify → diagnose → query_knowledge → generate_fixes → await_approval → execute → validate → learn → done.
 *
 * Each run is a chain of {@link CompletableFuture} stages on the {@code aiTaskExecutor} pool.
 * The approval wait holds no thread: the chain resumes when {@link ApprovalAwaiter} completes.
 * A needs_more_info decision sends only the affected entities back to diagnosis, with the reviewer's feedback.
 */
@Service
@Slf4j
public class WorkflowEngine {

    private final TargetSystemClient targetSystemClient;
    private final DiagnosisService diagnosisService;
    private final KnowledgeGraph knowledgeGraph;
    private final FixGenerator fixGenerator;
    private final ApprovalQueue approvalQueue;
    private final ApprovalAwaiter approvalAwaiter;
    private final LearningStore learningStore;
    private final RunHistoryRecorder historyRecorder;
    private final TeamsNotificationService notificationService;
    private final WorkflowRunRegistry registry;
    private final RemediationConfig config;
    private final Clock clock;
    private final Executor executor;

    // runId -> proposalId -> entity the proposal targets
    private final Map<String, Map<String, AffectedEntity>> proposalEntities = new ConcurrentHashMap<>();

    public WorkflowEngine(TargetSystemClient targetSystemClient,
                          DiagnosisService diagnosisService,
                          KnowledgeGraph knowledgeGraph,
                          FixGenerator fixGenerator,
                          ApprovalQueue approvalQueue,
                          ApprovalAwaiter approvalAwaiter,
                          LearningStore learningStore,
                          RunHistoryRecorder historyRecorder,
                          TeamsNotificationService notificationService,
                          WorkflowRunRegistry registry,
                          RemediationConfig config,
                          Clock clock,
                          @Qualifier("aiTaskExecutor") Executor executor) {
        this.targetSystemClient = targetSystemClient;
        this.diagnosisService = diagnosisService;
        this.knowledgeGraph = knowledgeGraph;
        this.fixGenerator = fixGenerator;
        this.approvalQueue = approvalQueue;
        this.approvalAwaiter = approvalAwaiter;
        this.learningStore = learningStore;
        this.historyRecorder = historyRecorder;
        this.notificationService = notificationService;
        this.registry = registry;
        this.config = config;
        this.clock = clock;
        this.executor = executor;
    }

    /**
     * Start a run for {@code scope} and return immediately.
     */
    public WorkflowRun start(String scope) {
        WorkflowRun run = new WorkflowRun("wf-" + UUID.randomUUID().toString().substring(0, 8), scope, clock.instant());
        registry.register(run);
        log.info("[{}] Remediation run started for scope {}", run.getId(), scope);
        run(run);
        return run;
    }

    /**
     * Cancel a run that has not started executing.
     *
     * @throws IllegalStateException when the run is already executing or finished
     */
    public RunSummary cancel(String runId, String actor) {
        WorkflowRun run = registry.get(runId);
        if (!run.requestCancel(actor)) {
            throw new IllegalStateException("Run " + runId + " can no longer be cancelled (" + run.getState().wireName() + ")");
        }
        log.info("[{}] Cancellation requested by {}", runId, actor);
        approvalQueue.closeWorkflow(runId, CloseReason.CANCELLED, actor);
        return run.summary();
    }

    public List<WorkflowRun> runs() {
        return registry.all();
    }

    public WorkflowRun get(String runId) {
        return registry.get(runId);
    }

    /**
     * @return a future that completes with the final summary
     */
    CompletableFuture<RunSummary> run(WorkflowRun run) {
        proposalEntities.put(run.getId(), new ConcurrentHashMap<>());
        return CompletableFuture.supplyAsync(() -> identify(run), executor)
                .thenCompose(entities -> entities.isEmpty()
                        ? CompletableFuture.completedFuture(RunStatus.NO_ACTION)
                        : reviewRound(run, entities, Map.of(), 1))
                .exceptionally(e -> failed(run, e))
                .thenApply(status -> finish(run, status));
    }

    // ========== IDENTIFY → GENERATE_FIXES ==========

    private List<AffectedEntity> identify(WorkflowRun run) {
        run.moveTo(WorkflowState.IDENTIFY);
        List<AffectedEntity> entities = targetSystemClient.identify(run.getScope());
        log.info("[{}] Identified {} unhealthy entit{} in {}", run.getId(), entities.size(),
                entities.size() == 1 ? "y" : "ies", run.getScope());
        return entities;
    }

    private CompletableFuture<RunStatus> reviewRound(WorkflowRun run, List<AffectedEntity> entities,
                                                     Map<String, String> feedback, int round) {
        if (run.isCancelRequested()) {
            return CompletableFuture.completedFuture(cancelled(run));
        }

        // 1. diagnose
        run.moveTo(WorkflowState.DIAGNOSE);
        List<Diagnosis> diagnoses = new ArrayList<>();
        for (AffectedEntity entity : entities) {
            Diagnosis diagnosis = diagnosisService.diagnose(entity, feedback.get(entity.getId()));
            if (!diagnosis.hasPattern()) {
                log.info("[{}] No known pattern for {}, manual investigation required", run.getId(), entity.getId());
                run.addManualInvestigation(entity.getId());
                continue;
            }
            diagnoses.add(diagnosis);
        }

        // 2. record findings
        run.moveTo(WorkflowState.QUERY_KNOWLEDGE);
        diagnoses.forEach(diagnosis -> recordFindings(run, diagnosis, round));

        // 3. one proposal per entity
        run.moveTo(WorkflowState.GENERATE_FIXES);
        List<FixProposal> proposals = new ArrayList<>();
        Map<String, AffectedEntity> targets = proposalEntities.get(run.getId());
        for (Diagnosis diagnosis : diagnoses) {
            try {
                FixProposal proposal = fixGenerator.generate(run.getId(), diagnosis.entity(), diagnosis.bundle(),
                        diagnosis.patterns());
                proposals.add(proposal);
                targets.put(proposal.getId(), diagnosis.entity());
            } catch (ProposalValidationException e) {
                log.warn("[{}] Skipping invalid proposal for {}: {}", run.getId(), diagnosis.entity().getId(), e.getMessage());
                run.addError("invalid proposal for " + diagnosis.entity().getId() + ": " + e.getMessage());
            }
        }

        if (proposals.isEmpty()) {
            log.info("[{}] Round {} produced no proposals", run.getId(), round);
            return execute(run);
        }

        List<ApprovalRecord> submitted;
        try {
            submitted = approvalQueue.submit(run.getId(), proposals);
        } catch (ProposalValidationException e) {
            log.warn("[{}] Proposals rejected at submission: {}", run.getId(), e.getMessage());
            run.addError("submission rejected: " + e.getMessage());
            return execute(run);
        }
        submitted.forEach(record -> run.addProposal(record.proposalId()));
        notificationService.notifyProposalsSubmitted(run.getId(), run.getScope(), submitted).subscribe();

        // 4. wait for reviewers
        run.moveTo(WorkflowState.AWAIT_APPROVAL);
        List<String> roundProposalIds = submitted.stream().map(ApprovalRecord::proposalId).toList();
        return approvalAwaiter.await(run.getId(), config.getApprovalTimeout(), config.getPollInterval(), run.cancellation())
                .thenComposeAsync(outcome -> afterReview(run, outcome, roundProposalIds, round), executor);
    }

    private void recordFindings(WorkflowRun run, Diagnosis diagnosis, int round) {
        AffectedEntity entity = diagnosis.entity();
        List<String> patterns = new ArrayList<>(diagnosis.patterns());
        for (String patternId : patterns) {
            Finding finding = Finding.builder()
                    .id(run.getId() + ":" + entity.getId() + ":" + patternId + ":" + round)
                    .entityId(entity.getId())
                    .description(entity.getReason() != null
                            ? entity.getReason() + " matched " + patternId
                            : "matched " + patternId)
                    .severity(patternId.equals(diagnosis.primaryPattern()) ? "high" : "medium")
                    .detectedAt(diagnosis.bundle().collectedAt())
                    .toolName("kubectl")
                    .patternId(patternId)
                    .build();
            knowledgeGraph.addFinding(finding, diagnosisService.categoryOf(patternId));
        }
        for (int i = 0; i < patterns.size(); i++) {
            for (int j = i + 1; j < patterns.size(); j++) {
                knowledgeGraph.linkSimilar(NodeType.CAUSE.idFor(patterns.get(i)), NodeType.CAUSE.idFor(patterns.get(j)));
            }
        }
    }

    // ========== AWAIT_APPROVAL ==========

    private CompletableFuture<RunStatus> afterReview(WorkflowRun run, AwaitOutcome outcome,
                                                     List<String> roundProposalIds, int round) {
        switch (outcome) {
            case CANCELLED:
                return CompletableFuture.completedFuture(cancelled(run));
            case TIMEOUT:
                log.warn("[{}] No decision within {}, expiring open proposals", run.getId(), config.getApprovalTimeout());
                approvalQueue.closeWorkflow(run.getId(), CloseReason.APPROVAL_TIMEOUT, ApprovalQueue.SYSTEM_ACTOR);
                return CompletableFuture.completedFuture(RunStatus.TIMEOUT);
            default:
                break;
        }

        if (approvalQueue.status(run.getId()).anyRejected()) {
            log.info("[{}] A proposal was rejected, closing the run without execution", run.getId());
            approvalQueue.closeWorkflow(run.getId(), CloseReason.WORKFLOW_REJECTED, ApprovalQueue.SYSTEM_ACTOR);
            return CompletableFuture.completedFuture(RunStatus.REJECTED);
        }

        List<AffectedEntity> retry = new ArrayList<>();
        Map<String, String> feedback = new LinkedHashMap<>();
        Map<String, AffectedEntity> targets = proposalEntities.get(run.getId());
        for (String proposalId : roundProposalIds) {
            ApprovalRecord record = approvalQueue.get(proposalId);
            if (record.status() != ApprovalStatus.NEEDS_MORE_INFO) {
                continue;
            }
            AffectedEntity entity = targets.get(proposalId);
            int rounds = run.incrementMoreInfoRounds(entity.getId());
            if (rounds > config.getMaxNeedsMoreInfoRounds()) {
                log.info("[{}] {} needed more info {} times, leaving it for manual investigation",
                        run.getId(), entity.getId(), rounds);
                run.addManualInvestigation(entity.getId());
                continue;
            }
            retry.add(entity);
            if (record.feedback() != null) {
                feedback.put(entity.getId(), record.feedback());
            }
        }

        if (!retry.isEmpty()) {
            log.info("[{}] Re-diagnosing {} entit{} after needs_more_info", run.getId(), retry.size(),
                    retry.size() == 1 ? "y" : "ies");
            return reviewRound(run, retry, feedback, round + 1);
        }
        return execute(run);
    }

    // ========== EXECUTE → LEARN ==========

    private CompletableFuture<RunStatus> execute(WorkflowRun run) {
        RunStatus status = executeApproved(run);
        return status != null ? CompletableFuture.completedFuture(status) : validate(run);
    }

    /**
     * Apply every approved proposal.
     *
     * @return the final status when nothing is left to validate, or null to continue with validation
     */
    private RunStatus executeApproved(WorkflowRun run) {
        if (!run.beginExecution()) {
            return cancelled(run);
        }
        List<ApprovalRecord> approved = approvalQueue.records(run.getId()).stream()
                .filter(r -> r.status() == ApprovalStatus.APPROVED)
                .toList();
        if (approved.isEmpty()) {
            log.info("[{}] Nothing approved to execute", run.getId());
            return learnAndConclude(run);
        }

        int applied = 0;
        for (ApprovalRecord record : approved) {
            FixProposal proposal = record.proposal();
            try {
                approvalQueue.startExecution(proposal.getId(), ApprovalQueue.SYSTEM_ACTOR);
            } catch (InvalidTransitionException e) {
                log.warn("[{}] Proposal {} is no longer executable: {}", run.getId(), proposal.getId(), e.getMessage());
                continue;
            }

            ExecutionResult result = apply(run, proposal.getProposedAction());
            if (result.success()) {
                log.info("[{}] Applied {} to {}", run.getId(), proposal.getId(), proposal.getEntityId());
                applied++;
                continue;
            }

            log.error("[{}] Action of {} failed on {}: {}", run.getId(), proposal.getId(), proposal.getEntityId(), result.output());
            ExecutionResult rollback = apply(run, proposal.getRollbackAction());
            String detail = "apply failed: " + result.output()
                    + (rollback.success() ? "; rolled back" : "; rollback failed: " + rollback.output());
            approvalQueue.finishExecution(proposal.getId(), false, detail);
            run.recordOutcome(new ProposalOutcome(proposal.getId(), proposal.getEntityId(), proposal.getPatternId(),
                    ApprovalStatus.FAILED, rollback.success(), detail));
        }
        return applied == 0 ? learnAndConclude(run) : null;
    }

    private ExecutionResult apply(WorkflowRun run, ProposedAction action) {
        try {
            return targetSystemClient.apply(action);
        } catch (RuntimeException e) {
            log.error("[{}] Target system error applying {}", run.getId(), action.commandLine(), e);
            return ExecutionResult.failure(e.getMessage(), clock.instant());
        }
    }

    private CompletableFuture<RunStatus> validate(WorkflowRun run) {
        Executor delayed = CompletableFuture.delayedExecutor(config.getSettleDelay().toMillis(), TimeUnit.MILLISECONDS, executor);
        return CompletableFuture.supplyAsync(() -> {
            run.moveTo(WorkflowState.VALIDATE);
            Map<String, AffectedEntity> targets = proposalEntities.get(run.getId());
            for (ApprovalRecord record : approvalQueue.records(run.getId())) {
                if (record.status() != ApprovalStatus.EXECUTING) {
                    continue;
                }
                FixProposal proposal = record.proposal();
                HealthCheckResult health = checkHealth(run, targets.get(proposal.getId()));
                approvalQueue.finishExecution(proposal.getId(), health.healthy(), health.detail());
                run.recordOutcome(new ProposalOutcome(proposal.getId(), proposal.getEntityId(), proposal.getPatternId(),
                        health.healthy() ? ApprovalStatus.COMPLETED : ApprovalStatus.FAILED, false, health.detail()));
                log.info("[{}] {} after {}: {}", run.getId(), proposal.getEntityId(), proposal.getId(),
                        health.healthy() ? "healthy" : "still unhealthy");
            }
            return learnAndConclude(run);
        }, delayed);
    }

    private HealthCheckResult checkHealth(WorkflowRun run, AffectedEntity entity) {
        if (entity == null) {
            return HealthCheckResult.unhealthy("entity unknown");
        }
        try {
            return targetSystemClient.checkHealth(entity);
        } catch (RuntimeException e) {
            log.error("[{}] Health check of {} failed", run.getId(), entity.getId(), e);
            return HealthCheckResult.unhealthy("health check failed: " + e.getMessage());
        }
    }

    private RunStatus learnAndConclude(WorkflowRun run) {
        run.moveTo(WorkflowState.LEARN);
        Map<String, AffectedEntity> targets = proposalEntities.get(run.getId());
        List<RemediationOutcome> outcomes = new ArrayList<>();
        int completed = 0;
        int failed = 0;
        for (ProposalOutcome outcome : run.getOutcomes()) {
            if (!outcome.executed()) {
                continue;
            }
            boolean success = outcome.finalStatus() == ApprovalStatus.COMPLETED;
            if (success) {
                completed++;
            } else {
                failed++;
            }
            AffectedEntity entity = targets.get(outcome.proposalId());
            outcomes.add(new RemediationOutcome(outcome.patternId(), approvalQueue.get(outcome.proposalId()).proposal(),
                    success, entity != null ? entity.getScope() : run.getScope(), outcome.detail(), clock.instant()));
        }
        learningStore.recordAll(outcomes);

        if (completed == 0 && failed == 0) {
            return RunStatus.NO_ACTION;
        }
        if (failed == 0) {
            return RunStatus.COMPLETED;
        }
        return completed == 0 ? RunStatus.FAILED : RunStatus.PARTIAL_FAILURE;
    }

    // ========== DONE ==========

    private RunStatus cancelled(WorkflowRun run) {
        String actor = run.getCancelledBy() != null ? run.getCancelledBy() : ApprovalQueue.SYSTEM_ACTOR;
        approvalQueue.closeWorkflow(run.getId(), CloseReason.CANCELLED, actor);
        log.info("[{}] Run cancelled by {}", run.getId(), actor);
        return RunStatus.CANCELLED;
    }

    private RunStatus failed(WorkflowRun run, Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        log.error("[{}] Run failed in {}", run.getId(), run.getState().wireName(), cause);
        run.addError(cause.getClass().getSimpleName() + ": " + cause.getMessage());
        try {
            approvalQueue.closeWorkflow(run.getId(), CloseReason.RUN_FAILED, ApprovalQueue.SYSTEM_ACTOR);
        } catch (RuntimeException e) {
            log.warn("[{}] Could not close proposals of failed run: {}", run.getId(), e.getMessage());
        }
        return RunStatus.ERROR;
    }

    private RunSummary finish(WorkflowRun run, RunStatus status) {
        for (ApprovalRecord record : approvalQueue.records(run.getId())) {
            if (!run.hasOutcome(record.proposalId())) {
                FixProposal proposal = record.proposal();
                run.recordOutcome(new ProposalOutcome(proposal.getId(), proposal.getEntityId(), proposal.getPatternId(),
                        record.status(), false, record.feedback()));
            }
        }
        run.finish(status, clock.instant());
        proposalEntities.remove(run.getId());

        RunSummary summary = run.summary();
        log.info("[{}] Run finished: {} ({} proposal(s), {} for manual investigation)", run.getId(),
                status.wireName(), summary.proposalIds().size(), summary.manualInvestigation().size());

        historyRecorder.record(summary);
        notificationService.notifyRunFinished(summary).subscribe();
        approvalQueue.closeStream(run.getId());
        return summary;
    }
}
