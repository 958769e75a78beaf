package com.team.remediation.model.workflow;

import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Mutable state of one remediation run. Written by the engine, read by API callers;
 * every access is synchronized on the run.
 */
public class WorkflowRun {

    private final String id;
    private final String scope;
    private final Instant startedAt;

    private RunStatus status = RunStatus.RUNNING;
    private WorkflowState state = WorkflowState.IDENTIFY;
    private Instant finishedAt;
    private boolean cancelRequested;
    private String cancelledBy;

    private final Set<String> proposalIds = new LinkedHashSet<>();
    private final Map<String, ProposalOutcome> outcomes = new LinkedHashMap<>();
    private final List<String> manualInvestigation = new ArrayList<>();
    private final List<String> errors = new ArrayList<>();
    private final Map<String, Integer> moreInfoRounds = new HashMap<>();

    private final Sinks.One<Void> cancellation = Sinks.one();

    public WorkflowRun(String id, String scope, Instant startedAt) {
        this.id = id;
        this.scope = scope;
        this.startedAt = startedAt;
    }

    public String getId() {
        return id;
    }

    public String getScope() {
        return scope;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public synchronized RunStatus getStatus() {
        return status;
    }

    public synchronized WorkflowState getState() {
        return state;
    }

    public synchronized void moveTo(WorkflowState next) {
        this.state = next;
    }

    /**
     * Enter the execute step unless the run was cancelled first.
     *
     * @return false when cancellation won
     */
    public synchronized boolean beginExecution() {
        if (cancelRequested) {
            return false;
        }
        state = WorkflowState.EXECUTE;
        return true;
    }

    /**
     * @return false when the run already started executing or finished
     */
    public synchronized boolean requestCancel(String actor) {
        if (!state.isCancellable() || status.isFinished()) {
            return false;
        }
        if (!cancelRequested) {
            cancelRequested = true;
            cancelledBy = actor;
            cancellation.tryEmitEmpty();
        }
        return true;
    }

    public synchronized boolean isCancelRequested() {
        return cancelRequested;
    }

    public synchronized String getCancelledBy() {
        return cancelledBy;
    }

    /**
     * Completes empty when the run is cancelled.
     */
    public Mono<Void> cancellation() {
        return cancellation.asMono();
    }

    public synchronized void addProposal(String proposalId) {
        proposalIds.add(proposalId);
    }

    public synchronized void recordOutcome(ProposalOutcome outcome) {
        outcomes.put(outcome.proposalId(), outcome);
    }

    public synchronized boolean hasOutcome(String proposalId) {
        return outcomes.containsKey(proposalId);
    }

    public synchronized List<ProposalOutcome> getOutcomes() {
        return List.copyOf(outcomes.values());
    }

    public synchronized void addManualInvestigation(String entityId) {
        manualInvestigation.add(entityId);
    }

    public synchronized void addError(String error) {
        errors.add(error);
    }

    /**
     * @return the number of needs_more_info rounds for the entity after incrementing
     */
    public synchronized int incrementMoreInfoRounds(String entityId) {
        return moreInfoRounds.merge(entityId, 1, Integer::sum);
    }

    public synchronized void finish(RunStatus finalStatus, Instant at) {
        this.status = finalStatus;
        this.state = WorkflowState.DONE;
        this.finishedAt = at;
    }

    public synchronized RunSummary summary() {
        return new RunSummary(id, scope, status, state, startedAt, finishedAt,
                List.copyOf(proposalIds), List.copyOf(outcomes.values()),
                List.copyOf(manualInvestigation), List.copyOf(errors));
    }
}
