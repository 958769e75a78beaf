package com.team.remediation.model.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Directed, typed edge. Several edges may connect the same pair of nodes.
 */
public record Edge(String fromId, String toId, Relation relation, Map<String, Object> metadata) {

    public Edge {
        Objects.requireNonNull(fromId, "fromId");
        Objects.requireNonNull(toId, "toId");
        Objects.requireNonNull(relation, "relation");
        metadata = metadata == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static Edge of(String fromId, String toId, Relation relation) {
        return new Edge(fromId, toId, relation, Map.of());
    }

    public boolean connects(String from, String to, Relation rel) {
        return fromId.equals(from) && toId.equals(to) && relation == rel;
    }

    public Edge withMetadata(Map<String, Object> newMetadata) {
        return new Edge(fromId, toId, relation, newMetadata);
    }
}
