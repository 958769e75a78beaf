package com.team.remediation.service.workflow;

import com.team.remediation.config.RemediationConfig;
import com.team.remediation.exception.WorkflowRunNotFoundException;
import com.team.remediation.model.workflow.WorkflowRun;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs known to this process. Running runs are always kept; finished ones beyond
 * {@code maxRetainedRuns} are dropped oldest first, their history stays in the run table.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class WorkflowRunRegistry {

    private final RemediationConfig config;
    private final Map<String, WorkflowRun> runs = new ConcurrentHashMap<>();

    public void register(WorkflowRun run) {
        if (runs.putIfAbsent(run.getId(), run) != null) {
            throw new IllegalStateException("Workflow run already registered: " + run.getId());
        }
        evictFinished();
    }

    public Optional<WorkflowRun> find(String runId) {
        return Optional.ofNullable(runs.get(runId));
    }

    public WorkflowRun get(String runId) {
        return find(runId).orElseThrow(() -> new WorkflowRunNotFoundException(runId));
    }

    /**
     * All runs, newest first.
     */
    public List<WorkflowRun> all() {
        return runs.values().stream()
                .sorted(Comparator.comparing(WorkflowRun::getStartedAt).reversed())
                .toList();
    }

    public int size() {
        return runs.size();
    }

    void evictFinished() {
        List<WorkflowRun> finished = runs.values().stream()
                .filter(run -> run.getStatus().isFinished())
                .sorted(Comparator.comparing(WorkflowRun::getStartedAt))
                .toList();
        int excess = finished.size() - config.getMaxRetainedRuns();
        for (int i = 0; i < excess; i++) {
            runs.remove(finished.get(i).getId());
        }
        if (excess > 0) {
            log.debug("Dropped {} finished run(s) from memory", excess);
        }
    }
}
