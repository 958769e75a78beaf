package com.team.remediation.service.target;

import com.team.remediation.model.diagnosis.AffectedEntity;
import com.team.remediation.model.proposal.ProposedAction;

import java.util.List;

/**
 * The system whose workloads are inspected and remediated.
 */
public interface TargetSystemClient {

    /**
     * Entities in {@code scope} that currently look unhealthy. Empty means the scope is healthy.
     *
     * @throws com.team.remediation.exception.TargetSystemException when the scope cannot be inspected
     */
    List<AffectedEntity> identify(String scope);

    /**
     * Raw logs and events of one entity, oldest first.
     */
    List<String> collectSignals(AffectedEntity entity);

    ExecutionResult apply(ProposedAction action);

    HealthCheckResult checkHealth(AffectedEntity entity);
}
