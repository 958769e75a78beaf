package com.team.remediation.model.graph;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * On-disk form of a {@link GraphSnapshot}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class GraphDocument {

    public static final String FORMAT = "remediation-knowledge-graph";
    public static final int VERSION = 1;

    private String format;
    private int version;
    private Instant savedAt;

    @Builder.Default
    private List<Node> nodes = new ArrayList<>();

    @Builder.Default
    private List<Edge> edges = new ArrayList<>();

    @Builder.Default
    private List<String> findingIds = new ArrayList<>();

    public static GraphDocument from(GraphSnapshot snapshot, Instant savedAt) {
        return GraphDocument.builder()
                .format(FORMAT)
                .version(VERSION)
                .savedAt(savedAt)
                .nodes(new ArrayList<>(snapshot.nodes()))
                .edges(new ArrayList<>(snapshot.edges()))
                .findingIds(new ArrayList<>(snapshot.findingIds()))
                .build();
    }

    public GraphSnapshot toSnapshot() {
        if (!FORMAT.equals(format)) {
            throw new IllegalArgumentException("Unexpected graph document format: " + format);
        }
        if (version > VERSION) {
            throw new IllegalArgumentException("Unsupported graph document version: " + version);
        }
        return GraphSnapshot.of(
                nodes != null ? nodes : List.of(),
                edges != null ? edges : List.of(),
                findingIds != null ? findingIds : List.of());
    }
}
