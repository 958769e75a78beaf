package com.team.remediation.model.graph;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Vertex types of the knowledge graph. Node ids are namespaced by type prefix,
 * e.g. {@code cause:resource_exhaustion} or {@code entity:api-1}.
 */
public enum NodeType {

    CAUSE("cause"),
    FIX("fix"),
    TOOL("tool"),
    ENTITY("entity"),
    CATEGORY("category");

    private final String wireName;

    NodeType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public String prefix() {
        return wireName + ":";
    }

    /**
     * Build a namespaced node id from a local key.
     */
    public String idFor(String key) {
        return prefix() + key;
    }

    @JsonCreator
    public static NodeType fromWireName(String value) {
        for (NodeType type : values()) {
            if (type.wireName.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown node type: " + value);
    }
}
