package com.team.remediation.model.diagnosis;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * A workload instance found unhealthy in a scope (e.g. a pod in a namespace).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AffectedEntity {

    public static final String MEMORY_LIMIT = "memory_limit";
    public static final String CPU_LIMIT = "cpu_limit";

    private String id;              // e.g. "api-1"
    private String scope;           // e.g. namespace "payments"
    private String workload;        // owning deployment, null when unknown
    private String container;
    private String image;
    private int restartCount;
    private String reason;          // e.g. "CrashLoopBackOff"

    @Builder.Default
    private Map<String, String> attributes = new HashMap<>();

    public String attribute(String key) {
        return attributes != null ? attributes.get(key) : null;
    }
}
