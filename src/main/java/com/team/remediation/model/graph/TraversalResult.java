package com.team.remediation.model.graph;

import java.util.List;

/**
 * Result of a bounded breadth-first traversal: visited ids in visit order and the visited nodes.
 */
public record TraversalResult(List<String> path, List<Node> nodes) {

    public static TraversalResult empty() {
        return new TraversalResult(List.of(), List.of());
    }
}
