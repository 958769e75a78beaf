package com.team.remediation.model.dto;

/**
 * @param scope where to look for unhealthy entities, e.g. a Kubernetes namespace
 */
public record StartWorkflowRequest(String scope) {
}
