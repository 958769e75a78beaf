package com.team.remediation.model.approval;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One event on a workflow's stream, serialized flat as {@code {"event": ..., "workflow_id": ..., ...payload}}.
 */
@JsonPropertyOrder({"event", "workflow_id", "timestamp"})
public final class ApprovalEvent {

    private final ApprovalEventType type;
    private final String workflowId;
    private final Instant timestamp;
    private final Map<String, Object> payload;

    public ApprovalEvent(ApprovalEventType type, String workflowId, Instant timestamp, Map<String, Object> payload) {
        this.type = type;
        this.workflowId = workflowId;
        this.timestamp = timestamp;
        this.payload = payload == null ? Map.of() : new LinkedHashMap<>(payload);
    }

    public static ApprovalEvent of(ApprovalEventType type, String workflowId, Instant timestamp) {
        return new ApprovalEvent(type, workflowId, timestamp, Map.of());
    }

    @JsonProperty("event")
    public ApprovalEventType type() {
        return type;
    }

    @JsonProperty("workflow_id")
    public String workflowId() {
        return workflowId;
    }

    @JsonProperty("timestamp")
    public Instant timestamp() {
        return timestamp;
    }

    @JsonAnyGetter
    public Map<String, Object> payload() {
        return payload;
    }

    @JsonIgnore
    public Object get(String key) {
        return payload.get(key);
    }

    @Override
    public String toString() {
        return "ApprovalEvent{" + type.wireName() + ", workflow=" + workflowId + ", payload=" + payload + "}";
    }
}
