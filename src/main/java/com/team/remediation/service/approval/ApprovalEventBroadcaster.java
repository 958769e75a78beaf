package com.team.remediation.service.approval;

import com.team.remediation.model.approval.ApprovalEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Per-workflow hot event streams. Events are not replayed; a new subscriber first receives
 * the event produced by its {@code connected} supplier.
 *
 * Producers {@link #stage} events while they hold the workflow's lock and {@link #flush} them after
 * releasing it. Staging order is delivery order. Each subscriber consumes on its own worker with
 * its own buffer, so a slow consumer never holds up producers or other subscribers.
 */
@Component
@Slf4j
public class ApprovalEventBroadcaster {

    private final Map<String, Channel> channels = new ConcurrentHashMap<>();
    private final Scheduler deliveryScheduler;

    public ApprovalEventBroadcaster() {
        this(Schedulers.boundedElastic());
    }

    ApprovalEventBroadcaster(Scheduler deliveryScheduler) {
        this.deliveryScheduler = deliveryScheduler;
    }

    public Flux<ApprovalEvent> subscribe(String workflowId, Supplier<ApprovalEvent> connected) {
        Flux<ApprovalEvent> events = Flux.create(out -> {
            Gate gate = new Gate(out);
            Disposable[] upstream = new Disposable[1];
            Channel[] joined = new Channel[1];
            // joining inside compute keeps an idle channel from being evicted under us
            channels.compute(workflowId, (id, existing) -> {
                Channel channel = existing != null ? existing : new Channel();
                upstream[0] = channel.sink.asFlux().subscribe(gate::next, gate::error, gate::complete);
                joined[0] = channel;
                return channel;
            });
            out.onDispose(() -> {
                upstream[0].dispose();
                evictIfIdle(workflowId, joined[0]);
            });
            // the snapshot is taken after joining, so nothing published meanwhile is missed
            gate.open(connected.get());
        }, FluxSink.OverflowStrategy.BUFFER);

        return events
                .publishOn(deliveryScheduler)
                .doOnSubscribe(s -> log.debug("[{}] Event subscriber connected", workflowId))
                .doFinally(signal -> log.debug("[{}] Event subscriber left ({})", workflowId, signal));
    }

    /**
     * Queue an event for the workflow's current subscribers. Cheap enough to call under a lock.
     */
    public void stage(ApprovalEvent event) {
        Channel channel = channels.get(event.workflowId());
        if (channel != null) {
            channel.outbox.add(event);
        }
    }

    /**
     * Emit staged events of the workflow in staging order. Concurrent callers drain cooperatively.
     */
    public void flush(String workflowId) {
        Channel channel = channels.get(workflowId);
        if (channel != null) {
            channel.drain(workflowId);
        }
    }

    public void publish(ApprovalEvent event) {
        stage(event);
        flush(event.workflowId());
    }

    /**
     * Complete the workflow's stream; later subscribers get a fresh one.
     */
    public void close(String workflowId) {
        Channel channel = channels.remove(workflowId);
        if (channel != null) {
            channel.drain(workflowId);
            synchronized (channel) {
                channel.sink.tryEmitComplete();
            }
        }
    }

    public int subscriberCount(String workflowId) {
        Channel channel = channels.get(workflowId);
        return channel == null ? 0 : channel.sink.currentSubscriberCount();
    }

    public int totalSubscribers() {
        return channels.values().stream().mapToInt(c -> c.sink.currentSubscriberCount()).sum();
    }

    int channelCount() {
        return channels.size();
    }

    private void evictIfIdle(String workflowId, Channel channel) {
        channels.computeIfPresent(workflowId, (id, current) ->
                current == channel && current.sink.currentSubscriberCount() == 0 ? null : current);
    }

    private static final class Channel {

        private final Sinks.Many<ApprovalEvent> sink = Sinks.many().multicast().directBestEffort();
        private final Queue<ApprovalEvent> outbox = new ConcurrentLinkedQueue<>();
        private final AtomicInteger wip = new AtomicInteger();

        void drain(String workflowId) {
            if (wip.getAndIncrement() != 0) {
                return;
            }
            int missed = 1;
            do {
                ApprovalEvent event;
                while ((event = outbox.poll()) != null) {
                    Sinks.EmitResult result;
                    synchronized (this) {
                        result = sink.tryEmitNext(event);
                    }
                    if (result.isFailure() && result != Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
                        log.warn("[{}] Dropped {} event: {}", workflowId, event.type().wireName(), result);
                    }
                }
                missed = wip.addAndGet(-missed);
            } while (missed != 0);
        }
    }

    /**
     * Holds live events back until the connected event has gone out.
     */
    private static final class Gate {

        private final FluxSink<ApprovalEvent> out;
        private List<ApprovalEvent> early = new ArrayList<>();
        private boolean completed;
        private Throwable failure;

        Gate(FluxSink<ApprovalEvent> out) {
            this.out = out;
        }

        synchronized void next(ApprovalEvent event) {
            if (early != null) {
                early.add(event);
            } else {
                out.next(event);
            }
        }

        synchronized void error(Throwable error) {
            if (early != null) {
                failure = error;
            } else {
                out.error(error);
            }
        }

        synchronized void complete() {
            if (early != null) {
                completed = true;
            } else {
                out.complete();
            }
        }

        synchronized void open(ApprovalEvent connected) {
            out.next(connected);
            early.forEach(out::next);
            early = null;
            if (failure != null) {
                out.error(failure);
            } else if (completed) {
                out.complete();
            }
        }
    }
}
