package com.team.remediation.model.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Knowledge graph vertex. Immutable; a node is never removed once added.
 */
public record Node(String id, NodeType type, String label, Map<String, String> attributes) {

    public Node {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(type, "type");
        if (!id.startsWith(type.prefix())) {
            throw new IllegalArgumentException("Node id '" + id + "' must start with '" + type.prefix() + "'");
        }
        label = label != null ? label : id;
        attributes = attributes == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public static Node of(NodeType type, String key, String label) {
        return new Node(type.idFor(key), type, label, Map.of());
    }

    public static Node of(NodeType type, String key, String label, Map<String, String> attributes) {
        return new Node(type.idFor(key), type, label, attributes);
    }

    /**
     * Case-insensitive substring match over id, label and attribute values.
     */
    public boolean matches(String lowerCaseQuery) {
        if (id.toLowerCase().contains(lowerCaseQuery) || label.toLowerCase().contains(lowerCaseQuery)) {
            return true;
        }
        for (String value : attributes.values()) {
            if (value != null && value.toLowerCase().contains(lowerCaseQuery)) {
                return true;
            }
        }
        return false;
    }
}
