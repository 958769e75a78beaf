package com.team.remediation.model.graph;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable view of the whole graph. Writers derive a new snapshot through {@link #toBuilder()},
 * so readers holding a reference never see a half-applied update.
 *
 * Iteration order of nodes and edges is insertion order.
 */
public final class GraphSnapshot {

    private static final GraphSnapshot EMPTY = new GraphSnapshot(Map.of(), List.of(), Set.of());

    private final Map<String, Node> nodes;
    private final List<Edge> edges;
    private final Map<String, List<Edge>> outgoing;
    private final Set<String> findingIds;

    private GraphSnapshot(Map<String, Node> nodes, List<Edge> edges, Set<String> findingIds) {
        this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
        this.edges = List.copyOf(edges);
        this.findingIds = Collections.unmodifiableSet(new LinkedHashSet<>(findingIds));

        Map<String, List<Edge>> index = new LinkedHashMap<>();
        for (Edge edge : this.edges) {
            index.computeIfAbsent(edge.fromId(), k -> new ArrayList<>()).add(edge);
        }
        index.replaceAll((k, v) -> List.copyOf(v));
        this.outgoing = Collections.unmodifiableMap(index);
    }

    public static GraphSnapshot empty() {
        return EMPTY;
    }

    public static GraphSnapshot of(Collection<Node> nodes, List<Edge> edges, Collection<String> findingIds) {
        Builder builder = new Builder(EMPTY);
        nodes.forEach(builder::addNode);
        edges.forEach(builder::addEdge);
        findingIds.forEach(builder::markFinding);
        return builder.build();
    }

    public Optional<Node> node(String id) {
        return Optional.ofNullable(nodes.get(id));
    }

    public boolean containsNode(String id) {
        return nodes.containsKey(id);
    }

    public Collection<Node> nodes() {
        return nodes.values();
    }

    public List<Edge> edges() {
        return edges;
    }

    public List<Edge> outgoing(String nodeId) {
        return outgoing.getOrDefault(nodeId, List.of());
    }

    public boolean hasEdge(String fromId, String toId, Relation relation) {
        return outgoing(fromId).stream().anyMatch(e -> e.connects(fromId, toId, relation));
    }

    public boolean containsFinding(String findingId) {
        return findingIds.contains(findingId);
    }

    public Set<String> findingIds() {
        return findingIds;
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    /**
     * Mutable working copy. Not thread-safe; owned by a single writer.
     */
    public static final class Builder {

        private final Map<String, Node> nodes;
        private final List<Edge> edges;
        private final Set<String> findingIds;
        private int nodesAdded;
        private int edgesAdded;
        private boolean modified;

        private Builder(GraphSnapshot base) {
            this.nodes = new LinkedHashMap<>(base.nodes);
            this.edges = new ArrayList<>(base.edges);
            this.findingIds = new LinkedHashSet<>(base.findingIds);
        }

        public boolean containsNode(String id) {
            return nodes.containsKey(id);
        }

        /**
         * @return true if the node was new
         */
        public boolean addNode(Node node) {
            if (nodes.containsKey(node.id())) {
                return false;
            }
            nodes.put(node.id(), node);
            nodesAdded++;
            modified = true;
            return true;
        }

        public void addEdge(Edge edge) {
            if (!nodes.containsKey(edge.fromId()) || !nodes.containsKey(edge.toId())) {
                throw new IllegalArgumentException(
                        "Edge endpoints must exist: " + edge.fromId() + " -> " + edge.toId());
            }
            if (edge.relation() == Relation.INSTANCE_OF) {
                checkInstanceOf(edge);
            }
            edges.add(edge);
            edgesAdded++;
            modified = true;
        }

        /**
         * @return true if the edge was new
         */
        public boolean addEdgeIfAbsent(Edge edge) {
            if (findEdge(edge.fromId(), edge.toId(), edge.relation()).isPresent()) {
                return false;
            }
            addEdge(edge);
            return true;
        }

        public Optional<Edge> findEdge(String fromId, String toId, Relation relation) {
            return edges.stream().filter(e -> e.connects(fromId, toId, relation)).findFirst();
        }

        public Optional<Edge> findEdgeFrom(String fromId, Relation relation) {
            return edges.stream().filter(e -> e.fromId().equals(fromId) && e.relation() == relation).findFirst();
        }

        /**
         * Swap the first edge matching (from, to, relation) for {@code replacement}, keeping its position.
         */
        public void replaceEdge(Edge existing, Edge replacement) {
            int index = edges.indexOf(existing);
            if (index < 0) {
                throw new IllegalArgumentException("Edge not present: " + existing);
            }
            edges.set(index, replacement);
            modified = true;
        }

        public boolean containsFinding(String findingId) {
            return findingIds.contains(findingId);
        }

        public void markFinding(String findingId) {
            if (findingIds.add(findingId)) {
                modified = true;
            }
        }

        public boolean isModified() {
            return modified;
        }

        public int nodesAdded() {
            return nodesAdded;
        }

        public int edgesAdded() {
            return edgesAdded;
        }

        public GraphSnapshot build() {
            return new GraphSnapshot(nodes, edges, findingIds);
        }

        private void checkInstanceOf(Edge edge) {
            NodeType sourceType = nodes.get(edge.fromId()).type();
            NodeType targetType = nodes.get(edge.toId()).type();
            if ((sourceType != NodeType.CAUSE && sourceType != NodeType.ENTITY)
                    || targetType != NodeType.CATEGORY) {
                throw new IllegalArgumentException(
                        "instance_of must link a cause/entity to a category: " + edge.fromId() + " -> " + edge.toId());
            }
        }
    }
}
