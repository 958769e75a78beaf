package com.team.remediation.service.workflow;

import com.team.remediation.model.approval.WorkflowApprovalStatus;
import com.team.remediation.service.approval.ApprovalQueue;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Waits for a workflow's review to settle without holding a thread.
 *
 * Status is re-checked on every event of the workflow's stream and on a fixed poll interval;
 * the wait ends when nothing is pending, a proposal is rejected, the run is cancelled, or the timeout elapses.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ApprovalAwaiter {

    private final ApprovalQueue approvalQueue;

    public CompletableFuture<AwaitOutcome> await(String workflowId, Duration timeout, Duration pollInterval,
                                                 Mono<Void> cancellation) {
        Flux<Object> triggers = Flux.merge(
                approvalQueue.subscribe(workflowId).cast(Object.class),
                Flux.interval(pollInterval).cast(Object.class));

        Mono<AwaitOutcome> decided = triggers
                .map(trigger -> approvalQueue.status(workflowId))
                .filter(ApprovalAwaiter::isSettled)
                .next()
                .map(status -> AwaitOutcome.DECIDED);

        Mono<AwaitOutcome> cancelled = cancellation.then(Mono.just(AwaitOutcome.CANCELLED));

        return Mono.firstWithSignal(decided, cancelled)
                .timeout(timeout, Mono.just(AwaitOutcome.TIMEOUT))
                .doOnNext(outcome -> log.info("[{}] Approval wait ended: {}", workflowId, outcome))
                .toFuture();
    }

    static boolean isSettled(WorkflowApprovalStatus status) {
        return status.anyRejected() || status.isDecided();
    }
}
