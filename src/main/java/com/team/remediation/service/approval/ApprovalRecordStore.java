package com.team.remediation.service.approval;

import com.team.remediation.model.approval.ApprovalRecord;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Storage of approval records. The queue owns all state changes; a store only has to make
 * {@link #update} atomic per record.
 */
public interface ApprovalRecordStore {

    /**
     * @throws IllegalStateException when a record with the same proposal id exists
     */
    void insert(ApprovalRecord record);

    Optional<ApprovalRecord> find(String proposalId);

    /**
     * Atomically replace a record with {@code change.apply(current)}. An exception thrown by
     * {@code change} leaves the stored record untouched and propagates.
     *
     * @return the stored result, or empty when the record does not exist
     */
    Optional<ApprovalRecord> update(String proposalId, UnaryOperator<ApprovalRecord> change);

    /**
     * Records of a workflow in submission order.
     */
    List<ApprovalRecord> findByWorkflow(String workflowId);

    Collection<ApprovalRecord> findAll();

    Collection<String> workflowIds();
}
