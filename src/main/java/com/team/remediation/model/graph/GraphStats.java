package com.team.remediation.model.graph;

import java.util.Map;

public record GraphStats(int totalNodes,
                         int totalEdges,
                         Map<String, Integer> nodeTypes,
                         Map<String, Integer> edgeTypes,
                         int findingsIngested) {
}
