package com.team.remediation.model.graph;

import java.util.Map;

/**
 * One-hop neighbour of a node along a single relation.
 */
public record Relationship(String targetId, Map<String, Object> metadata) {

    public long longValue(String key) {
        Object value = metadata.get(key);
        return value instanceof Number number ? number.longValue() : 0L;
    }
}
