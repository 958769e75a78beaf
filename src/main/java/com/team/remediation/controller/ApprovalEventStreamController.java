package com.team.remediation.controller;

import com.team.remediation.config.ApprovalConfig;
import com.team.remediation.model.approval.ApprovalEvent;
import com.team.remediation.model.approval.ApprovalEventType;
import com.team.remediation.service.approval.ApprovalQueue;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;

import java.io.IOException;
import java.time.Clock;
import java.util.Map;

/**
 * Server-Sent Events view of a workflow's approval events, with a periodic keep_alive.
 */
@RestController
@RequestMapping("/api/v1/remediation/approvals")
@Slf4j
@RequiredArgsConstructor
public class ApprovalEventStreamController {

    private final ApprovalQueue approvalQueue;
    private final ApprovalConfig approvalConfig;
    private final Clock clock;

    @GetMapping(path = "/workflow/{workflowId}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter events(@PathVariable String workflowId) {
        SseEmitter emitter = new SseEmitter(0L);

        Flux<ApprovalEvent> keepAlive = Flux.interval(approvalConfig.getKeepAliveInterval())
                .map(tick -> new ApprovalEvent(ApprovalEventType.KEEP_ALIVE, workflowId, clock.instant(), Map.of()));

        // the keep-alive ends with the workflow's stream
        Disposable subscription = approvalQueue.subscribe(workflowId)
                .publish(events -> Flux.merge(events, keepAlive.takeUntilOther(events.ignoreElements())))
                .subscribe(
                        event -> send(emitter, event),
                        error -> emitter.completeWithError(error),
                        emitter::complete);

        emitter.onCompletion(subscription::dispose);
        emitter.onTimeout(subscription::dispose);
        emitter.onError(e -> subscription.dispose());
        log.debug("[{}] Event stream opened", workflowId);
        return emitter;
    }

    private static void send(SseEmitter emitter, ApprovalEvent event) {
        try {
            emitter.send(SseEmitter.event().name(event.type().wireName()).data(event, MediaType.APPLICATION_JSON));
        } catch (IOException e) {
            // client went away
            emitter.completeWithError(e);
        }
    }
}
