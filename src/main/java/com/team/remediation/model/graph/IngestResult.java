package com.team.remediation.model.graph;

public record IngestResult(int nodesAdded, int edgesAdded) {

    public static final IngestResult NONE = new IngestResult(0, 0);
}
