package com.team.remediation.service.approval;

import com.team.remediation.model.approval.ApprovalRecord;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.UnaryOperator;

/**
 * Single-process record store. Updates go through {@link ConcurrentHashMap#computeIfPresent},
 * so concurrent changes to one record are serialized.
 */
@Component
public class InMemoryApprovalRecordStore implements ApprovalRecordStore {

    private final Map<String, ApprovalRecord> records = new ConcurrentHashMap<>();
    private final Map<String, List<String>> byWorkflow = new ConcurrentHashMap<>();

    @Override
    public void insert(ApprovalRecord record) {
        ApprovalRecord previous = records.putIfAbsent(record.proposalId(), record);
        if (previous != null) {
            throw new IllegalStateException("Approval record already exists: " + record.proposalId());
        }
        byWorkflow.computeIfAbsent(record.workflowId(), k -> new CopyOnWriteArrayList<>()).add(record.proposalId());
    }

    @Override
    public Optional<ApprovalRecord> find(String proposalId) {
        return Optional.ofNullable(records.get(proposalId));
    }

    @Override
    public Optional<ApprovalRecord> update(String proposalId, UnaryOperator<ApprovalRecord> change) {
        return Optional.ofNullable(records.computeIfPresent(proposalId, (id, current) -> change.apply(current)));
    }

    @Override
    public List<ApprovalRecord> findByWorkflow(String workflowId) {
        List<String> ids = byWorkflow.getOrDefault(workflowId, List.of());
        List<ApprovalRecord> result = new ArrayList<>(ids.size());
        for (String id : ids) {
            ApprovalRecord record = records.get(id);
            if (record != null) {
                result.add(record);
            }
        }
        return result;
    }

    @Override
    public Collection<ApprovalRecord> findAll() {
        return List.copyOf(records.values());
    }

    @Override
    public Collection<String> workflowIds() {
        return List.copyOf(byWorkflow.keySet());
    }
}
