package com.team.remediation.service.approval;

import com.team.remediation.config.ApprovalConfig;
import com.team.remediation.exception.ApprovalNotFoundException;
import com.team.remediation.exception.InvalidTransitionException;
import com.team.remediation.exception.ProposalValidationException;
import com.team.remediation.model.approval.ApprovalEvent;
import com.team.remediation.model.approval.ApprovalEventType;
import com.team.remediation.model.approval.ApprovalRecord;
import com.team.remediation.model.approval.ApprovalStats;
import com.team.remediation.model.approval.ApprovalStatus;
import com.team.remediation.model.approval.CloseReason;
import com.team.remediation.model.approval.Decision;
import com.team.remediation.model.approval.WorkflowApprovalStatus;
import com.team.remediation.model.proposal.FixProposal;
import com.team.remediation.model.proposal.ProposalSource;
import com.team.remediation.model.proposal.ProposedAction;
import com.team.remediation.model.proposal.RiskLevel;
import com.team.remediation.service.fix.ProposalValidator;
import com.team.remediation.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertTimeout;

class ApprovalQueueTest {

    private final MutableClock clock = MutableClock.at("2026-03-01T10:00:00Z");
    private ApprovalQueue queue;

    @BeforeEach
    void setUp() {
        queue = new ApprovalQueue(new InMemoryApprovalRecordStore(), new ApprovalEventBroadcaster(),
                new ProposalValidator(), new ApprovalConfig(), clock);
    }

    static FixProposal proposal(String id, RiskLevel risk, double confidence) {
        return FixProposal.builder()
                .id(id)
                .workflowId("ignored")
                .entityId("api-" + id)
                .scope("payments")
                .rootCause("OOMKilled")
                .proposedAction(ProposedAction.of("raise limit", "kubectl", "set", "resources", "deployment/api"))
                .rollbackAction(ProposedAction.of("restore limit", "kubectl", "set", "resources", "deployment/api"))
                .riskLevel(risk)
                .confidence(confidence)
                .patternId("resource_exhaustion")
                .fixId("increase_memory_limit")
                .source(ProposalSource.FALLBACK)
                .build();
    }

    private void submitThree() {
        queue.submit("wf-1", List.of(
                proposal("p1", RiskLevel.LOW, 0.7),
                proposal("p2", RiskLevel.HIGH, 0.4),
                proposal("p3", RiskLevel.MEDIUM, 0.5)));
    }

    @Test
    void submitBindsWorkflowAndPutsRecordsUnderReview() {
        List<ApprovalRecord> records = queue.submit("wf-1", List.of(proposal("p1", RiskLevel.LOW, 0.7)));

        ApprovalRecord record = records.get(0);
        assertThat(record.workflowId()).isEqualTo("wf-1");
        assertThat(record.status()).isEqualTo(ApprovalStatus.PENDING_REVIEW);
        assertThat(record.expiresAt()).isEqualTo(clock.instant().plus(Duration.ofHours(24)));
        assertThat(record.auditTrail()).hasSize(1);
        assertThat(queue.pending(null)).extracting(ApprovalRecord::proposalId).containsExactly("p1");
    }

    @Test
    void submitIsAllOrNothing() {
        FixProposal invalid = proposal("p2", RiskLevel.LOW, 0.5).toBuilder().rootCause(" ").build();

        assertThatThrownBy(() -> queue.submit("wf-1", List.of(proposal("p1", RiskLevel.LOW, 0.7), invalid)))
                .isInstanceOf(ProposalValidationException.class);
        assertThat(queue.find("p1")).isEmpty();
    }

    @Test
    void duplicateSubmissionIsRejected() {
        queue.submit("wf-1", List.of(proposal("p1", RiskLevel.LOW, 0.7)));

        assertThatThrownBy(() -> queue.submit("wf-2", List.of(proposal("p1", RiskLevel.LOW, 0.7))))
                .isInstanceOf(ProposalValidationException.class);
        assertThat(queue.get("p1").workflowId()).isEqualTo("wf-1");
    }

    @Test
    void recordsArePresentedByRiskThenConfidence() {
        submitThree();
        queue.submit("wf-1", List.of(proposal("p4", RiskLevel.HIGH, 0.2)));

        assertThat(queue.records("wf-1")).extracting(ApprovalRecord::proposalId)
                .containsExactly("p4", "p2", "p3", "p1");
    }

    @Test
    void decideRecordsActorAndRejectsSecondDecision() {
        submitThree();

        ApprovalRecord decided = queue.decide("p1", Decision.APPROVED, "alice", "looks right");

        assertThat(decided.status()).isEqualTo(ApprovalStatus.APPROVED);
        assertThat(decided.decidedBy()).isEqualTo("alice");
        assertThat(decided.feedback()).isEqualTo("looks right");
        assertThat(decided.auditTrail()).hasSize(2);
        assertThatThrownBy(() -> queue.decide("p1", Decision.REJECTED, "bob"))
                .isInstanceOf(InvalidTransitionException.class);
        assertThat(queue.get("p1").status()).isEqualTo(ApprovalStatus.APPROVED);
    }

    @Test
    void unknownProposalIsNotFound() {
        assertThatThrownBy(() -> queue.decide("missing", Decision.APPROVED, "alice"))
                .isInstanceOf(ApprovalNotFoundException.class);
    }

    @Test
    void concurrentDecisionsOnOneProposalSucceedExactlyOnce() throws Exception {
        queue.submit("wf-1", List.of(proposal("p1", RiskLevel.LOW, 0.7)));
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger successes = new AtomicInteger();
        AtomicInteger conflicts = new AtomicInteger();
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                Decision decision = i % 2 == 0 ? Decision.APPROVED : Decision.REJECTED;
                String actor = "reviewer-" + i;
                futures.add(pool.submit(() -> {
                    start.await();
                    try {
                        queue.decide("p1", decision, actor);
                        successes.incrementAndGet();
                    } catch (InvalidTransitionException e) {
                        conflicts.incrementAndGet();
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(5, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(successes.get()).isEqualTo(1);
        assertThat(conflicts.get()).isEqualTo(threads - 1);
        assertThat(queue.get("p1").auditTrail()).hasSize(2);
    }

    @Test
    void batchApproveDecidesEveryPendingRecord() {
        submitThree();

        List<ApprovalRecord> decided = queue.decideBatch("wf-1", Decision.APPROVED, "alice");

        assertThat(decided).hasSize(3);
        WorkflowApprovalStatus status = queue.status("wf-1");
        assertThat(status.allApproved()).isTrue();
        assertThat(status.anyRejected()).isFalse();
        assertThat(status.pendingCount()).isZero();
        assertThat(status.isDecided()).isTrue();
    }

    @Test
    void batchSkipsAlreadyDecidedRecords() {
        submitThree();
        queue.decide("p2", Decision.REJECTED, "bob");

        List<ApprovalRecord> decided = queue.decideBatch("wf-1", Decision.APPROVED, "alice");

        assertThat(decided).extracting(ApprovalRecord::proposalId).containsExactly("p3", "p1");
        WorkflowApprovalStatus status = queue.status("wf-1");
        assertThat(status.allApproved()).isFalse();
        assertThat(status.anyRejected()).isTrue();
        assertThat(queue.decideBatch("wf-1", Decision.REJECTED, "bob")).isEmpty();
    }

    @Test
    void statusOfUnknownWorkflowIsEmpty() {
        assertThat(queue.status("wf-none")).isEqualTo(WorkflowApprovalStatus.EMPTY);
        assertThat(queue.status("wf-none").isDecided()).isFalse();
    }

    @Test
    void expiryFollowsRiskTimeToLive() {
        submitThree();

        clock.advance(Duration.ofHours(1));
        assertThat(queue.expireDue()).isEqualTo(1);
        assertThat(queue.get("p2").status()).isEqualTo(ApprovalStatus.EXPIRED);

        clock.advance(Duration.ofHours(3));
        assertThat(queue.expireDue()).isEqualTo(1);
        assertThat(queue.get("p3").status()).isEqualTo(ApprovalStatus.EXPIRED);
        assertThat(queue.get("p1").status()).isEqualTo(ApprovalStatus.PENDING_REVIEW);
        assertThat(queue.expireDue()).isZero();
    }

    @Test
    void approvalRearmsTimeToLive() {
        queue.submit("wf-1", List.of(proposal("p1", RiskLevel.HIGH, 0.4)));
        clock.advance(Duration.ofMinutes(50));
        queue.decide("p1", Decision.APPROVED, "alice");

        clock.advance(Duration.ofMinutes(30));

        assertThat(queue.expireDue()).isZero();
        assertThat(queue.get("p1").status()).isEqualTo(ApprovalStatus.APPROVED);
    }

    @Test
    void closeWorkflowCancelsOpenRecordsOnly() {
        submitThree();
        queue.decide("p1", Decision.APPROVED, "alice");
        queue.decide("p3", Decision.NEEDS_MORE_INFO, "alice", "which container?");

        List<ApprovalRecord> changed = queue.closeWorkflow("wf-1", CloseReason.CANCELLED, "ops");

        assertThat(changed).extracting(ApprovalRecord::proposalId).containsExactlyInAnyOrder("p1", "p2");
        assertThat(changed).allMatch(r -> r.status() == ApprovalStatus.REJECTED);
        assertThat(queue.get("p3").status()).isEqualTo(ApprovalStatus.NEEDS_MORE_INFO);
    }

    @Test
    void timeoutClosesPendingAndApprovedAsExpired() {
        submitThree();
        queue.decide("p1", Decision.APPROVED, "alice");

        queue.closeWorkflow("wf-1", CloseReason.APPROVAL_TIMEOUT, ApprovalQueue.SYSTEM_ACTOR);

        assertThat(queue.records("wf-1")).allMatch(r -> r.status() == ApprovalStatus.EXPIRED);
    }

    @Test
    void executionTransitionsFollowApproval() {
        queue.submit("wf-1", List.of(proposal("p1", RiskLevel.LOW, 0.7)));

        assertThatThrownBy(() -> queue.startExecution("p1", "engine"))
                .isInstanceOf(InvalidTransitionException.class);

        queue.decide("p1", Decision.APPROVED, "alice");
        queue.startExecution("p1", "engine");
        ApprovalRecord finished = queue.finishExecution("p1", true, "pod healthy");

        assertThat(finished.status()).isEqualTo(ApprovalStatus.COMPLETED);
        assertThat(finished.decidedBy()).isEqualTo("alice");
        assertThat(finished.auditTrail()).extracting(e -> e.to())
                .containsExactly(ApprovalStatus.PENDING_REVIEW, ApprovalStatus.APPROVED,
                        ApprovalStatus.EXECUTING, ApprovalStatus.COMPLETED);
    }

    @Test
    void statsCountRecordsByStatusAndPendingRisk() {
        submitThree();
        queue.decide("p1", Decision.REJECTED, "alice");

        ApprovalStats stats = queue.stats();

        assertThat(stats.totalRecords()).isEqualTo(3);
        assertThat(stats.byStatus()).containsEntry("pending_review", 2).containsEntry("rejected", 1);
        assertThat(stats.pendingByRisk()).containsEntry("HIGH", 1).containsEntry("MEDIUM", 1).containsEntry("LOW", 0);
        assertThat(stats.activeWorkflows()).isEqualTo(1);
    }

    @Test
    void subscriberReceivesConnectedEventFirst() {
        queue.submit("wf-1", List.of(proposal("p1", RiskLevel.LOW, 0.7)));

        StepVerifier.create(queue.subscribe("wf-1"))
                .assertNext(event -> {
                    assertThat(event.type()).isEqualTo(ApprovalEventType.CONNECTED);
                    assertThat(event.get("pending_count")).isEqualTo(1);
                })
                .then(() -> queue.decide("p1", Decision.APPROVED, "alice"))
                .assertNext(event -> {
                    assertThat(event.type()).isEqualTo(ApprovalEventType.DECIDED);
                    assertThat(event.get("proposal_id")).isEqualTo("p1");
                    assertThat(event.get("pending_count")).isEqualTo(0);
                })
                .then(() -> queue.closeStream("wf-1"))
                .verifyComplete();
    }

    @Test
    void batchPublishesOneEvent() {
        submitThree();

        StepVerifier.create(queue.subscribe("wf-1"))
                .assertNext(event -> assertThat(event.type()).isEqualTo(ApprovalEventType.CONNECTED))
                .then(() -> queue.decideBatch("wf-1", Decision.REJECTED, "bob"))
                .assertNext(event -> {
                    assertThat(event.type()).isEqualTo(ApprovalEventType.BATCH_REJECTED);
                    assertThat(event.get("count")).isEqualTo(3);
                })
                .thenCancel()
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void batchRacingSingleDecisionsDecidesEachRecordExactlyOnce() throws Exception {
        List<String> ids = List.of("p1", "p2", "p3", "p4");
        queue.submit("wf-1", ids.stream().map(id -> proposal(id, RiskLevel.MEDIUM, 0.5)).toList());
        List<ApprovalEvent> events = new CopyOnWriteArrayList<>();
        Disposable subscription = queue.subscribe("wf-1").subscribe(events::add);

        ExecutorService pool = Executors.newFixedThreadPool(9);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger singleSuccesses = new AtomicInteger();
        AtomicInteger conflicts = new AtomicInteger();
        List<Future<List<ApprovalRecord>>> batches = new ArrayList<>();
        List<Future<?>> singles = new ArrayList<>();
        try {
            batches.add(pool.submit(() -> {
                start.await();
                return queue.decideBatch("wf-1", Decision.APPROVED, "lead");
            }));
            for (int i = 0; i < 8; i++) {
                String proposalId = ids.get(i % ids.size());
                String actor = "reviewer-" + i;
                singles.add(pool.submit(() -> {
                    start.await();
                    try {
                        queue.decide(proposalId, Decision.REJECTED, actor);
                        singleSuccesses.incrementAndGet();
                    } catch (InvalidTransitionException e) {
                        conflicts.incrementAndGet();
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> single : singles) {
                single.get(5, TimeUnit.SECONDS);
            }
            List<ApprovalRecord> batched = batches.get(0).get(5, TimeUnit.SECONDS);

            assertThat(batched.size() + singleSuccesses.get()).isEqualTo(ids.size());
            assertThat(singleSuccesses.get() + conflicts.get()).isEqualTo(8);
            for (String id : ids) {
                assertThat(queue.get(id).auditTrail()).hasSize(2);
            }

            int expectedEvents = singleSuccesses.get() + (batched.isEmpty() ? 0 : 1);
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            while (decisionEvents(events).size() < expectedEvents && System.nanoTime() < deadline) {
                Thread.sleep(10);
            }
            List<String> decidedIds = new ArrayList<>();
            for (ApprovalEvent event : decisionEvents(events)) {
                if (event.type() == ApprovalEventType.DECIDED) {
                    decidedIds.add((String) event.get("proposal_id"));
                } else {
                    for (Object id : (List<?>) event.get("proposal_ids")) {
                        decidedIds.add((String) id);
                    }
                }
            }
            assertThat(decidedIds).containsExactlyInAnyOrderElementsOf(ids);
        } finally {
            pool.shutdownNow();
            subscription.dispose();
        }
    }

    private static List<ApprovalEvent> decisionEvents(List<ApprovalEvent> events) {
        return events.stream()
                .filter(e -> e.type() == ApprovalEventType.DECIDED || e.type() == ApprovalEventType.BATCH_APPROVED)
                .toList();
    }

    @Test
    void slowSubscriberDoesNotHoldUpDecisions() throws Exception {
        submitThree();
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch delivered = new CountDownLatch(3);
        List<ApprovalEventType> seen = new CopyOnWriteArrayList<>();
        Disposable subscription = queue.subscribe("wf-1").subscribe(event -> {
            seen.add(event.type());
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            delivered.countDown();
        });
        try {
            assertTimeout(Duration.ofSeconds(1), () -> {
                queue.decide("p1", Decision.APPROVED, "alice");
                queue.decideBatch("wf-1", Decision.APPROVED, "bob");
            });
            assertThat(queue.status("wf-1").allApproved()).isTrue();

            release.countDown();
            assertThat(delivered.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(seen).containsExactly(
                    ApprovalEventType.CONNECTED, ApprovalEventType.DECIDED, ApprovalEventType.BATCH_APPROVED);
        } finally {
            release.countDown();
            subscription.dispose();
        }
    }

    @Test
    void resubmittedProposalReplacesTheOneSentBackForMoreInfo() {
        queue.submit("wf-1", List.of(proposal("p1", RiskLevel.LOW, 0.7), proposal("p2", RiskLevel.LOW, 0.6)));
        queue.decide("p1", Decision.NEEDS_MORE_INFO, "alice", "which dependency?");
        queue.decide("p2", Decision.APPROVED, "alice");
        assertThat(queue.status("wf-1").allApproved()).isFalse();

        clock.advance(Duration.ofMinutes(1));
        queue.submit("wf-1", List.of(proposal("p1-r2", RiskLevel.LOW, 0.6).toBuilder().entityId("api-p1").build()));
        queue.decide("p1-r2", Decision.APPROVED, "alice");

        WorkflowApprovalStatus status = queue.status("wf-1");
        assertThat(status.allApproved()).isTrue();
        assertThat(status.needsMoreInfo()).isZero();
        assertThat(status.total()).isEqualTo(3);
        assertThat(queue.get("p1").status()).isEqualTo(ApprovalStatus.NEEDS_MORE_INFO);
    }

    @Test
    void unansweredMoreInfoRequestKeepsWorkflowFromBeingApproved() {
        queue.submit("wf-1", List.of(proposal("p1", RiskLevel.LOW, 0.7), proposal("p2", RiskLevel.LOW, 0.6)));
        queue.decide("p1", Decision.NEEDS_MORE_INFO, "alice");
        queue.decide("p2", Decision.APPROVED, "alice");

        WorkflowApprovalStatus status = queue.status("wf-1");
        assertThat(status.allApproved()).isFalse();
        assertThat(status.needsMoreInfo()).isEqualTo(1);
        assertThat(status.isDecided()).isTrue();
    }
}
