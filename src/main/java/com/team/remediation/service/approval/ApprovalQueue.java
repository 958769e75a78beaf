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
import com.team.remediation.model.proposal.RiskLevel;
import com.team.remediation.service.fix.ProposalValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Single source of truth for proposal review state.
 *
 * Each record changes atomically in the store, so one proposal is decided exactly once.
 * A per-workflow read/write lock orders the rest: single decisions share the read lock,
 * while submission, batch decisions, closing and expiry take the write lock. A batch therefore
 * never interleaves with a single decision of the same workflow. Events are staged under the lock,
 * which fixes their order, and delivered after it is released, so subscribers never run under it.
 * Locks are striped by workflow id and shared between workflows that hash alike.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ApprovalQueue {

    public static final String SYSTEM_ACTOR = "system";

    private static final Set<ApprovalStatus> APPROVED_OR_LATER = Set.of(
            ApprovalStatus.APPROVED, ApprovalStatus.EXECUTING, ApprovalStatus.COMPLETED, ApprovalStatus.FAILED);

    private final ApprovalRecordStore store;
    private final ApprovalEventBroadcaster broadcaster;
    private final ProposalValidator validator;
    private final ApprovalConfig config;
    private final Clock clock;

    private static final int LOCK_STRIPES = 64;

    private final ReadWriteLock[] workflowLocks = newStripes();

    // ========== SUBMISSION ==========

    /**
     * Put proposals under review. Either all of them are accepted or none is.
     *
     * @return the new records in presentation order
     * @throws ProposalValidationException when any proposal is invalid or already submitted
     */
    public List<ApprovalRecord> submit(String workflowId, List<FixProposal> proposals) {
        if (workflowId == null || workflowId.isBlank()) {
            throw new IllegalArgumentException("workflow id is required");
        }
        if (proposals == null || proposals.isEmpty()) {
            return List.of();
        }

        Lock lock = lockFor(workflowId).writeLock();
        lock.lock();
        try {
            Instant now = clock.instant();
            List<ApprovalRecord> created = new ArrayList<>(proposals.size());
            Set<String> seen = new HashSet<>();
            for (FixProposal proposal : proposals) {
                FixProposal bound = proposal.toBuilder().workflowId(workflowId).build();
                validator.validate(bound);
                if (!seen.add(bound.getId()) || store.find(bound.getId()).isPresent()) {
                    throw new ProposalValidationException(bound.getId(), List.of("proposal id already submitted"));
                }
                Instant expiresAt = now.plus(config.ttlFor(bound.getRiskLevel()));
                created.add(ApprovalRecord.pending(bound, SYSTEM_ACTOR, now, expiresAt));
            }
            created.forEach(store::insert);
            created.sort(ApprovalRecord.PRESENTATION_ORDER);

            log.info("[{}] Submitted {} proposal(s) for review", workflowId, created.size());

            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("proposal_ids", created.stream().map(ApprovalRecord::proposalId).toList());
            payload.put("count", created.size());
            payload.put("pending_count", pendingCount(workflowId));
            payload.put("proposals", created.stream().map(ApprovalQueue::summary).toList());
            broadcaster.stage(new ApprovalEvent(ApprovalEventType.SUBMITTED, workflowId, now, payload));
            return List.copyOf(created);
        } finally {
            lock.unlock();
            broadcaster.flush(workflowId);
        }
    }

    // ========== DECISIONS ==========

    /**
     * Decide one pending proposal.
     *
     * @throws ApprovalNotFoundException when the proposal is unknown
     * @throws InvalidTransitionException when the record is not in pending_review
     */
    public ApprovalRecord decide(String proposalId, Decision decision, String actor, String feedback) {
        ApprovalRecord current = get(proposalId);
        String workflowId = current.workflowId();

        Lock lock = lockFor(workflowId).readLock();
        lock.lock();
        try {
            Instant now = clock.instant();
            ApprovalRecord decided = store.update(proposalId, record -> applyDecision(record, decision, actor, feedback, now))
                    .orElseThrow(() -> new ApprovalNotFoundException("Proposal not found: " + proposalId));

            log.info("[{}] Proposal {} {} by {}", workflowId, proposalId, decided.status().wireName(), actor);

            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("proposal_id", proposalId);
            payload.put("status", decided.status().wireName());
            payload.put("decided_by", actor);
            payload.put("feedback", feedback);
            payload.put("pending_count", pendingCount(workflowId));
            broadcaster.stage(new ApprovalEvent(ApprovalEventType.DECIDED, workflowId, now, payload));
            return decided;
        } finally {
            lock.unlock();
            broadcaster.flush(workflowId);
        }
    }

    public ApprovalRecord decide(String proposalId, Decision decision, String actor) {
        return decide(proposalId, decision, actor, null);
    }

    /**
     * Apply one decision to every pending record of a workflow, atomically with respect to single decisions.
     *
     * @return the decided records in presentation order; empty when nothing was pending
     */
    public List<ApprovalRecord> decideBatch(String workflowId, Decision decision, String actor, String feedback) {
        Lock lock = lockFor(workflowId).writeLock();
        lock.lock();
        try {
            Instant now = clock.instant();
            List<ApprovalRecord> decided = new ArrayList<>();
            for (ApprovalRecord record : store.findByWorkflow(workflowId)) {
                if (record.status() != ApprovalStatus.PENDING_REVIEW) {
                    continue;
                }
                store.update(record.proposalId(), r -> applyDecision(r, decision, actor, feedback, now))
                        .ifPresent(decided::add);
            }
            decided.sort(ApprovalRecord.PRESENTATION_ORDER);

            if (decided.isEmpty()) {
                log.info("[{}] Batch {} by {}: nothing pending", workflowId, decision.wireName(), actor);
                return List.of();
            }
            log.info("[{}] Batch {} of {} proposal(s) by {}", workflowId, decision.wireName(), decided.size(), actor);

            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("proposal_ids", decided.stream().map(ApprovalRecord::proposalId).toList());
            payload.put("decision", decision.wireName());
            payload.put("decided_by", actor);
            payload.put("count", decided.size());
            payload.put("pending_count", pendingCount(workflowId));
            broadcaster.stage(new ApprovalEvent(ApprovalEventType.forBatch(decision), workflowId, now, payload));
            return List.copyOf(decided);
        } finally {
            lock.unlock();
            broadcaster.flush(workflowId);
        }
    }

    public List<ApprovalRecord> decideBatch(String workflowId, Decision decision, String actor) {
        return decideBatch(workflowId, decision, actor, null);
    }

    private ApprovalRecord applyDecision(ApprovalRecord record, Decision decision, String actor, String feedback, Instant now) {
        if (record.status() != ApprovalStatus.PENDING_REVIEW) {
            throw new InvalidTransitionException(record.proposalId(), record.status(), decision.targetStatus());
        }
        // approval re-arms the time-to-live for execution
        Instant expiresAt = decision == Decision.APPROVED
                ? now.plus(config.ttlFor(record.riskLevel()))
                : null;
        return record.transition(decision.targetStatus(), actor, now, feedback, expiresAt);
    }

    // ========== EXECUTION ==========

    /**
     * approved -> executing
     */
    public ApprovalRecord startExecution(String proposalId, String actor) {
        return executionTransition(proposalId, ApprovalStatus.EXECUTING, actor, null);
    }

    /**
     * executing -> completed | failed
     */
    public ApprovalRecord finishExecution(String proposalId, boolean success, String detail) {
        return executionTransition(proposalId, success ? ApprovalStatus.COMPLETED : ApprovalStatus.FAILED,
                SYSTEM_ACTOR, detail);
    }

    private ApprovalRecord executionTransition(String proposalId, ApprovalStatus next, String actor, String detail) {
        ApprovalRecord current = get(proposalId);
        Lock lock = lockFor(current.workflowId()).readLock();
        lock.lock();
        try {
            Instant now = clock.instant();
            ApprovalRecord updated = store.update(proposalId, r -> r.transition(next, actor, now, detail, null))
                    .orElseThrow(() -> new ApprovalNotFoundException("Proposal not found: " + proposalId));
            log.info("[{}] Proposal {} -> {}", current.workflowId(), proposalId, next.wireName());

            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("proposal_id", proposalId);
            payload.put("status", next.wireName());
            payload.put("detail", detail);
            broadcaster.stage(new ApprovalEvent(ApprovalEventType.EXECUTION_UPDATED, current.workflowId(), now, payload));
            return updated;
        } finally {
            lock.unlock();
            broadcaster.flush(current.workflowId());
        }
    }

    // ========== CLOSING & EXPIRY ==========

    /**
     * Move every open (pending_review or approved) record of a workflow to the state the reason dictates.
     *
     * @return the records that changed
     */
    public List<ApprovalRecord> closeWorkflow(String workflowId, CloseReason reason, String actor) {
        Lock lock = lockFor(workflowId).writeLock();
        lock.lock();
        try {
            Instant now = clock.instant();
            List<ApprovalRecord> changed = new ArrayList<>();
            for (ApprovalRecord record : store.findByWorkflow(workflowId)) {
                ApprovalStatus target = reason.targetFor(record.status());
                if (target == null) {
                    continue;
                }
                store.update(record.proposalId(), r -> {
                    ApprovalStatus next = reason.targetFor(r.status());
                    return next == null ? r : r.transition(next, actor, now, reason.feedback(), null);
                }).ifPresent(changed::add);
            }
            if (!changed.isEmpty()) {
                log.info("[{}] Closed {} open proposal(s): {}", workflowId, changed.size(), reason.feedback());
                publishClosed(workflowId, changed, reason.feedback(), now);
            }
            return changed;
        } finally {
            lock.unlock();
            broadcaster.flush(workflowId);
        }
    }

    /**
     * Expire records whose time-to-live has elapsed.
     *
     * @return number of records expired
     */
    public int expireDue() {
        Instant now = clock.instant();
        Map<String, List<String>> dueByWorkflow = new LinkedHashMap<>();
        for (ApprovalRecord record : store.findAll()) {
            if (record.isExpiredAt(now)) {
                dueByWorkflow.computeIfAbsent(record.workflowId(), k -> new ArrayList<>()).add(record.proposalId());
            }
        }

        int expired = 0;
        for (Map.Entry<String, List<String>> entry : dueByWorkflow.entrySet()) {
            String workflowId = entry.getKey();
            Lock lock = lockFor(workflowId).writeLock();
            lock.lock();
            try {
                List<ApprovalRecord> changed = new ArrayList<>();
                for (String proposalId : entry.getValue()) {
                    store.update(proposalId, r -> r.isExpiredAt(now)
                                    ? r.transition(ApprovalStatus.EXPIRED, SYSTEM_ACTOR, now, "ttl elapsed", null)
                                    : r)
                            .filter(r -> r.status() == ApprovalStatus.EXPIRED)
                            .ifPresent(changed::add);
                }
                if (!changed.isEmpty()) {
                    log.info("[{}] Expired {} proposal(s) past their time-to-live", workflowId, changed.size());
                    publishClosed(workflowId, changed, "ttl elapsed", now);
                    expired += changed.size();
                }
            } finally {
                lock.unlock();
                broadcaster.flush(workflowId);
            }
        }
        return expired;
    }

    private void publishClosed(String workflowId, List<ApprovalRecord> changed, String reason, Instant now) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("proposal_ids", changed.stream().map(ApprovalRecord::proposalId).toList());
        payload.put("statuses", changed.stream().map(r -> r.status().wireName()).toList());
        payload.put("reason", reason);
        payload.put("pending_count", pendingCount(workflowId));
        broadcaster.stage(new ApprovalEvent(ApprovalEventType.EXPIRED, workflowId, now, payload));
    }

    // ========== QUERIES ==========

    public WorkflowApprovalStatus status(String workflowId) {
        Lock lock = lockFor(workflowId).readLock();
        lock.lock();
        try {
            List<ApprovalRecord> records = store.findByWorkflow(workflowId);
            if (records.isEmpty()) {
                return WorkflowApprovalStatus.EMPTY;
            }
            int pending = 0;
            int moreInfo = 0;
            boolean allApproved = true;
            boolean anyRejected = false;
            for (ApprovalRecord record : records) {
                if (isSuperseded(record, records)) {
                    continue;
                }
                ApprovalStatus status = record.status();
                if (status == ApprovalStatus.PENDING_REVIEW) {
                    pending++;
                }
                if (status == ApprovalStatus.NEEDS_MORE_INFO) {
                    moreInfo++;
                }
                if (status == ApprovalStatus.REJECTED) {
                    anyRejected = true;
                }
                if (!APPROVED_OR_LATER.contains(status)) {
                    allApproved = false;
                }
            }
            return new WorkflowApprovalStatus(allApproved, anyRejected, pending, moreInfo, records.size());
        } finally {
            lock.unlock();
        }
    }

    /**
     * A needs_more_info record is replaced by any proposal for the same entity submitted after the decision.
     */
    private static boolean isSuperseded(ApprovalRecord record, List<ApprovalRecord> workflowRecords) {
        if (record.status() != ApprovalStatus.NEEDS_MORE_INFO) {
            return false;
        }
        String entityId = record.proposal().getEntityId();
        return workflowRecords.stream().anyMatch(other -> !other.proposalId().equals(record.proposalId())
                && entityId != null
                && entityId.equals(other.proposal().getEntityId())
                && record.decidedAt() != null
                && !other.createdAt().isBefore(record.decidedAt()));
    }

    public ApprovalRecord get(String proposalId) {
        return store.find(proposalId)
                .orElseThrow(() -> new ApprovalNotFoundException("Proposal not found: " + proposalId));
    }

    public Optional<ApprovalRecord> find(String proposalId) {
        return store.find(proposalId);
    }

    /**
     * Records still awaiting a reviewer, optionally restricted to one scope, in presentation order.
     */
    public List<ApprovalRecord> pending(String scope) {
        return store.findAll().stream()
                .filter(r -> r.status() == ApprovalStatus.PENDING_REVIEW)
                .filter(r -> scope == null || scope.isBlank() || scope.equals(r.proposal().getScope()))
                .sorted(ApprovalRecord.PRESENTATION_ORDER)
                .toList();
    }

    public List<ApprovalRecord> records(String workflowId) {
        return store.findByWorkflow(workflowId).stream()
                .sorted(ApprovalRecord.PRESENTATION_ORDER)
                .toList();
    }

    public ApprovalStats stats() {
        Map<String, Integer> byStatus = new TreeMap<>();
        Map<String, Integer> pendingByRisk = new LinkedHashMap<>();
        for (RiskLevel risk : RiskLevel.values()) {
            pendingByRisk.put(risk.name(), 0);
        }
        Set<String> activeWorkflows = new HashSet<>();
        int total = 0;
        for (ApprovalRecord record : store.findAll()) {
            total++;
            byStatus.merge(record.status().wireName(), 1, Integer::sum);
            if (record.status() == ApprovalStatus.PENDING_REVIEW && record.riskLevel() != null) {
                pendingByRisk.merge(record.riskLevel().name(), 1, Integer::sum);
            }
            if (record.status() == ApprovalStatus.PENDING_REVIEW || record.status() == ApprovalStatus.APPROVED) {
                activeWorkflows.add(record.workflowId());
            }
        }
        return new ApprovalStats(total, byStatus, pendingByRisk, activeWorkflows.size(), broadcaster.totalSubscribers());
    }

    // ========== EVENTS ==========

    /**
     * Live events of a workflow, starting with a connected event that carries the current pending count.
     */
    public Flux<ApprovalEvent> subscribe(String workflowId) {
        return broadcaster.subscribe(workflowId, () -> new ApprovalEvent(ApprovalEventType.CONNECTED, workflowId,
                clock.instant(), Map.of("pending_count", pendingCount(workflowId))));
    }

    public void closeStream(String workflowId) {
        broadcaster.close(workflowId);
    }

    private int pendingCount(String workflowId) {
        return (int) store.findByWorkflow(workflowId).stream()
                .filter(r -> r.status() == ApprovalStatus.PENDING_REVIEW)
                .count();
    }

    private ReadWriteLock lockFor(String workflowId) {
        return workflowLocks[Math.floorMod(workflowId.hashCode(), LOCK_STRIPES)];
    }

    private static ReadWriteLock[] newStripes() {
        ReadWriteLock[] stripes = new ReadWriteLock[LOCK_STRIPES];
        for (int i = 0; i < stripes.length; i++) {
            stripes[i] = new ReentrantReadWriteLock();
        }
        return stripes;
    }

    private static Map<String, Object> summary(ApprovalRecord record) {
        FixProposal proposal = record.proposal();
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("proposal_id", proposal.getId());
        summary.put("entity_id", proposal.getEntityId());
        summary.put("risk_level", proposal.getRiskLevel());
        summary.put("confidence", proposal.getConfidence());
        summary.put("root_cause", proposal.getRootCause());
        summary.put("expires_at", record.expiresAt());
        return summary;
    }
}
