package com.team.remediation.service.workflow;

import com.team.remediation.config.RemediationConfig;
import com.team.remediation.exception.WorkflowRunNotFoundException;
import com.team.remediation.model.workflow.RunStatus;
import com.team.remediation.model.workflow.WorkflowRun;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkflowRunRegistryTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    private WorkflowRunRegistry registry;

    @BeforeEach
    void setUp() {
        RemediationConfig config = new RemediationConfig();
        config.setMaxRetainedRuns(2);
        registry = new WorkflowRunRegistry(config);
    }

    private WorkflowRun run(String id, int minute, boolean finished) {
        WorkflowRun run = new WorkflowRun(id, "payments", T0.plusSeconds(60L * minute));
        if (finished) {
            run.finish(RunStatus.COMPLETED, T0.plusSeconds(60L * minute + 30));
        }
        return run;
    }

    @Test
    void oldestFinishedRunsAreDroppedBeyondTheLimit() {
        registry.register(run("wf-1", 1, true));
        registry.register(run("wf-2", 2, false));
        registry.register(run("wf-3", 3, true));
        registry.register(run("wf-4", 4, true));

        assertThat(registry.find("wf-1")).isEmpty();
        assertThat(registry.all()).extracting(WorkflowRun::getId).containsExactly("wf-4", "wf-3", "wf-2");
    }

    @Test
    void runningRunsAreNeverDropped() {
        for (int i = 0; i < 5; i++) {
            registry.register(run("wf-" + i, i, false));
        }

        assertThat(registry.size()).isEqualTo(5);
    }

    @Test
    void duplicateAndUnknownIdsAreRejected() {
        registry.register(run("wf-1", 1, false));

        assertThatThrownBy(() -> registry.register(run("wf-1", 2, false))).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> registry.get("wf-9")).isInstanceOf(WorkflowRunNotFoundException.class);
    }
}
