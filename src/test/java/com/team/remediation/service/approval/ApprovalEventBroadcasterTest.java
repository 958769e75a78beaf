package com.team.remediation.service.approval;

import com.team.remediation.model.approval.ApprovalEvent;
import com.team.remediation.model.approval.ApprovalEventType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;

class ApprovalEventBroadcasterTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private ApprovalEventBroadcaster broadcaster;

    @BeforeEach
    void setUp() {
        broadcaster = new ApprovalEventBroadcaster(Schedulers.immediate());
    }

    private static ApprovalEvent event(ApprovalEventType type, String proposalId) {
        return new ApprovalEvent(type, "wf-1", NOW, Map.of("proposal_id", proposalId));
    }

    @Test
    void eventPublishedWhileTakingTheSnapshotFollowsTheConnectedEvent() {
        StepVerifier.create(broadcaster.subscribe("wf-1", () -> {
                    broadcaster.publish(event(ApprovalEventType.DECIDED, "p1"));
                    return ApprovalEvent.of(ApprovalEventType.CONNECTED, "wf-1", NOW);
                }))
                .expectNextMatches(e -> e.type() == ApprovalEventType.CONNECTED)
                .expectNextMatches(e -> e.type() == ApprovalEventType.DECIDED && "p1".equals(e.get("proposal_id")))
                .thenCancel()
                .verify(Duration.ofSeconds(5));
    }

    @Test
    void stagedEventsAreDeliveredOnlyOnFlushAndInStagingOrder() {
        List<ApprovalEvent> received = new CopyOnWriteArrayList<>();
        Disposable subscription = broadcaster.subscribe("wf-1",
                () -> ApprovalEvent.of(ApprovalEventType.CONNECTED, "wf-1", NOW)).subscribe(received::add);

        broadcaster.stage(event(ApprovalEventType.SUBMITTED, "p1"));
        broadcaster.stage(event(ApprovalEventType.DECIDED, "p1"));
        assertThat(received).extracting(ApprovalEvent::type).containsExactly(ApprovalEventType.CONNECTED);

        broadcaster.flush("wf-1");

        assertThat(received).extracting(ApprovalEvent::type).containsExactly(
                ApprovalEventType.CONNECTED, ApprovalEventType.SUBMITTED, ApprovalEventType.DECIDED);
        subscription.dispose();
    }

    @Test
    void channelIsEvictedWhenItsLastSubscriberLeaves() {
        Disposable first = broadcaster.subscribe("wf-1",
                () -> ApprovalEvent.of(ApprovalEventType.CONNECTED, "wf-1", NOW)).subscribe();
        Disposable second = broadcaster.subscribe("wf-1",
                () -> ApprovalEvent.of(ApprovalEventType.CONNECTED, "wf-1", NOW)).subscribe();
        assertThat(broadcaster.subscriberCount("wf-1")).isEqualTo(2);

        first.dispose();
        assertThat(broadcaster.channelCount()).isEqualTo(1);

        second.dispose();
        assertThat(broadcaster.channelCount()).isZero();
        assertThat(broadcaster.totalSubscribers()).isZero();
    }

    @Test
    void closeCompletesSubscribersAndDropsTheChannel() {
        StepVerifier.create(broadcaster.subscribe("wf-1",
                        () -> ApprovalEvent.of(ApprovalEventType.CONNECTED, "wf-1", NOW)))
                .expectNextMatches(e -> e.type() == ApprovalEventType.CONNECTED)
                .then(() -> broadcaster.close("wf-1"))
                .expectComplete()
                .verify(Duration.ofSeconds(5));

        assertThat(broadcaster.channelCount()).isZero();
    }

    @Test
    void eventsWithoutSubscribersAreDiscarded() {
        broadcaster.publish(event(ApprovalEventType.DECIDED, "p1"));

        assertThat(broadcaster.channelCount()).isZero();
    }
}
