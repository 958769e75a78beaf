package com.team.remediation.service.graph;

import com.team.remediation.config.KnowledgeGraphConfig;
import com.team.remediation.exception.GraphPersistenceException;
import com.team.remediation.model.graph.Edge;
import com.team.remediation.model.graph.Finding;
import com.team.remediation.model.graph.GraphSnapshot;
import com.team.remediation.model.graph.GraphStats;
import com.team.remediation.model.graph.IngestResult;
import com.team.remediation.model.graph.Node;
import com.team.remediation.model.graph.NodeType;
import com.team.remediation.model.graph.Relation;
import com.team.remediation.model.graph.Relationship;
import com.team.remediation.model.graph.TraversalResult;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Typed, directed multi-relation graph over causes, fixes, tools, categories and affected entities.
 *
 * Reads are lock-free against an immutable {@link GraphSnapshot}. Writers are serialized by a
 * short lock, build the next snapshot from a copy and publish it in one reference swap, so a
 * concurrent reader observes either the previous or the next snapshot in full.
 */
@Component
@Slf4j
public class KnowledgeGraph {

    public static final int DEFAULT_MAX_DEPTH = 2;

    /** Metadata keys of a cause -remediates-> fix edge */
    public static final String SUCCESS_COUNT = "success_count";
    public static final String ATTEMPT_COUNT = "attempt_count";
    public static final String SUCCESS_RATE = "success_rate";
    public static final String LAST_USED = "last_used";

    public static final String UNKNOWN = "unknown";
    public static final String UNCATEGORIZED = "uncategorized";

    private final KnowledgeGraphStore store;
    private final KnowledgeGraphConfig config;
    private final Clock clock;

    private final AtomicReference<GraphSnapshot> current = new AtomicReference<>(GraphSnapshot.empty());
    private final ReentrantLock writeLock = new ReentrantLock();

    public KnowledgeGraph(KnowledgeGraphStore store, KnowledgeGraphConfig config, Clock clock) {
        this.store = store;
        this.config = config;
        this.clock = clock;
    }

    @PostConstruct
    public void initialize() {
        if (config.isPersistenceEnabled()) {
            load();
        }
    }

    @PreDestroy
    public void shutdown() {
        if (config.isPersistenceEnabled()) {
            persist();
        }
    }

    public GraphSnapshot snapshot() {
        return current.get();
    }

    // ========== QUERIES ==========

    /**
     * Case-insensitive substring search over node id, label and attribute values, in insertion order.
     */
    public List<Node> findNodes(String query) {
        return findNodes(query, null);
    }

    public List<Node> findNodes(String query, NodeType type) {
        if (query == null) {
            return List.of();
        }
        String needle = query.toLowerCase();
        List<Node> matches = new ArrayList<>();
        for (Node node : current.get().nodes()) {
            if (type != null && node.type() != type) {
                continue;
            }
            if (node.matches(needle)) {
                matches.add(node);
            }
        }
        return matches;
    }

    public Optional<Node> getNode(String id) {
        return current.get().node(id);
    }

    public TraversalResult traverse(String startId) {
        return traverse(startId, DEFAULT_MAX_DEPTH, Set.of());
    }

    /**
     * Breadth-first traversal along outgoing edges, bounded by {@code maxDepth} hops.
     * An empty or null relation set follows every relation. Each node is visited at most once,
     * so cycles terminate; edge order is insertion order, so the result is deterministic per snapshot.
     */
    public TraversalResult traverse(String startId, int maxDepth, Set<Relation> relations) {
        GraphSnapshot graph = current.get();
        if (startId == null || !graph.containsNode(startId)) {
            return TraversalResult.empty();
        }
        int depthLimit = Math.max(0, maxDepth);
        boolean filtered = relations != null && !relations.isEmpty();

        List<String> path = new ArrayList<>();
        List<Node> nodes = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        Deque<Visit> queue = new ArrayDeque<>();

        visited.add(startId);
        queue.add(new Visit(startId, 0));

        while (!queue.isEmpty()) {
            Visit visit = queue.poll();
            path.add(visit.nodeId());
            graph.node(visit.nodeId()).ifPresent(nodes::add);

            if (visit.depth() >= depthLimit) {
                continue;
            }
            for (Edge edge : graph.outgoing(visit.nodeId())) {
                if (filtered && !relations.contains(edge.relation())) {
                    continue;
                }
                if (visited.add(edge.toId())) {
                    queue.add(new Visit(edge.toId(), visit.depth() + 1));
                }
            }
        }
        return new TraversalResult(List.copyOf(path), List.copyOf(nodes));
    }

    /**
     * Direct neighbours of a node along one relation, in insertion order.
     */
    public List<Relationship> getRelationships(String nodeId, Relation relation) {
        List<Relationship> result = new ArrayList<>();
        for (Edge edge : current.get().outgoing(nodeId)) {
            if (relation == null || edge.relation() == relation) {
                result.add(new Relationship(edge.toId(), edge.metadata()));
            }
        }
        return result;
    }

    public GraphStats stats() {
        GraphSnapshot graph = current.get();
        Map<String, Integer> nodeTypes = new TreeMap<>();
        for (NodeType type : NodeType.values()) {
            nodeTypes.put(type.wireName(), 0);
        }
        graph.nodes().forEach(n -> nodeTypes.merge(n.type().wireName(), 1, Integer::sum));

        Map<String, Integer> edgeTypes = new TreeMap<>();
        graph.edges().forEach(e -> edgeTypes.merge(e.relation().wireName(), 1, Integer::sum));

        return new GraphStats(graph.nodeCount(), graph.edgeCount(), nodeTypes, edgeTypes, graph.findingIds().size());
    }

    // ========== WRITES ==========

    /**
     * Ingest a finding. Re-adding a finding id that was already ingested changes nothing.
     *
     * Creates (if absent) the entity node, the cause node for the finding's pattern, its category
     * and the detecting tool, then links cause -instance_of-> category, cause -detected_by-> tool
     * and cause -found_in-> entity.
     */
    public IngestResult addFinding(Finding finding) {
        return addFinding(finding, UNCATEGORIZED);
    }

    public IngestResult addFinding(Finding finding, String category) {
        if (finding == null || isBlank(finding.getId()) || isBlank(finding.getEntityId())) {
            throw new IllegalArgumentException("Finding requires an id and an entity id");
        }

        IngestResult result = write(graph -> {
            if (graph.containsFinding(finding.getId())) {
                return IngestResult.NONE;
            }
            String patternId = isBlank(finding.getPatternId()) ? UNKNOWN : finding.getPatternId();
            String toolName = isBlank(finding.getToolName()) ? UNKNOWN : finding.getToolName();
            Instant detectedAt = finding.getDetectedAt() != null ? finding.getDetectedAt() : clock.instant();

            Node entity = Node.of(NodeType.ENTITY, finding.getEntityId(), finding.getEntityId());
            Node cause = Node.of(NodeType.CAUSE, patternId, humanize(patternId));
            Node tool = Node.of(NodeType.TOOL, toolName.toLowerCase(), toolName);
            graph.addNode(entity);
            graph.addNode(cause);
            graph.addNode(tool);

            boolean categorized = graph.findEdgeFrom(cause.id(), Relation.INSTANCE_OF).isPresent();
            if (!categorized) {
                String categoryKey = isBlank(category) ? UNCATEGORIZED : category;
                Node categoryNode = Node.of(NodeType.CATEGORY, categoryKey, humanize(categoryKey));
                graph.addNode(categoryNode);
                graph.addEdge(Edge.of(cause.id(), categoryNode.id(), Relation.INSTANCE_OF));
            }

            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("finding_id", finding.getId());
            metadata.put("severity", finding.getSeverity() != null ? finding.getSeverity() : UNKNOWN);
            metadata.put("detected_at", detectedAt.toString());
            graph.addEdge(new Edge(cause.id(), tool.id(), Relation.DETECTED_BY, metadata));

            Map<String, Object> foundIn = new LinkedHashMap<>(metadata);
            if (finding.getDescription() != null) {
                foundIn.put("description", finding.getDescription());
            }
            graph.addEdge(new Edge(cause.id(), entity.id(), Relation.FOUND_IN, foundIn));

            graph.markFinding(finding.getId());
            return new IngestResult(graph.nodesAdded(), graph.edgesAdded());
        });

        if (result.nodesAdded() > 0 || result.edgesAdded() > 0) {
            log.info("Ingested finding {} for {}: +{} nodes, +{} edges",
                    finding.getId(), finding.getEntityId(), result.nodesAdded(), result.edgesAdded());
        } else {
            log.debug("Finding {} already ingested, skipping", finding.getId());
        }
        return result;
    }

    public boolean addNode(Node node) {
        return write(graph -> graph.addNode(node));
    }

    public void addEdge(Edge edge) {
        write(graph -> {
            graph.addEdge(edge);
            return null;
        });
    }

    public boolean addEdgeIfAbsent(Edge edge) {
        return write(graph -> graph.addEdgeIfAbsent(edge));
    }

    /**
     * Link two cause nodes with similar_to edges in both directions, once.
     */
    public int linkSimilar(String firstId, String secondId) {
        if (firstId.equals(secondId)) {
            return 0;
        }
        return write(graph -> {
            if (!graph.containsNode(firstId) || !graph.containsNode(secondId)) {
                return 0;
            }
            int added = 0;
            if (graph.addEdgeIfAbsent(Edge.of(firstId, secondId, Relation.SIMILAR_TO))) {
                added++;
            }
            if (graph.addEdgeIfAbsent(Edge.of(secondId, firstId, Relation.SIMILAR_TO))) {
                added++;
            }
            return added;
        });
    }

    /**
     * Additively record one remediation attempt on the cause -remediates-> fix edge.
     * The read-modify-write happens under the writer lock, so concurrent calls never lose counts.
     *
     * @return the updated edge
     */
    public Edge recordRemediation(String causeId, Node fixNode, boolean success, Instant at) {
        return write(graph -> {
            if (!graph.containsNode(causeId)) {
                String key = causeId.startsWith(NodeType.CAUSE.prefix())
                        ? causeId.substring(NodeType.CAUSE.prefix().length())
                        : causeId;
                graph.addNode(Node.of(NodeType.CAUSE, key, humanize(key)));
            }
            graph.addNode(fixNode);

            Optional<Edge> existing = graph.findEdge(causeId, fixNode.id(), Relation.REMEDIATES);
            Map<String, Object> metadata = new LinkedHashMap<>(existing.map(Edge::metadata).orElse(Map.of()));
            long attempts = asLong(metadata.get(ATTEMPT_COUNT)) + 1;
            long successes = asLong(metadata.get(SUCCESS_COUNT)) + (success ? 1 : 0);
            metadata.put(SUCCESS_COUNT, successes);
            metadata.put(ATTEMPT_COUNT, attempts);
            metadata.put(SUCCESS_RATE, (double) successes / attempts);
            metadata.put(LAST_USED, at.toString());

            Edge updated = new Edge(causeId, fixNode.id(), Relation.REMEDIATES, metadata);
            if (existing.isPresent()) {
                graph.replaceEdge(existing.get(), updated);
            } else {
                graph.addEdge(updated);
            }
            return updated;
        });
    }

    // ========== PERSISTENCE ==========

    /**
     * Save the current snapshot. Failures are logged and reported, never thrown.
     */
    public boolean persist() {
        if (!config.isPersistenceEnabled()) {
            return false;
        }
        try {
            store.save(current.get(), clock.instant());
            return true;
        } catch (GraphPersistenceException e) {
            log.error("Knowledge graph persistence failed, keeping in-memory state: {}", e.getMessage(), e);
            return false;
        }
    }

    /**
     * Replace the in-memory graph with the stored snapshot; a missing or corrupt snapshot yields an empty graph.
     */
    public void load() {
        GraphSnapshot loaded = store.load().orElse(GraphSnapshot.empty());
        writeLock.lock();
        try {
            current.set(loaded);
        } finally {
            writeLock.unlock();
        }
    }

    <T> T write(Function<GraphSnapshot.Builder, T> mutation) {
        writeLock.lock();
        try {
            GraphSnapshot.Builder builder = current.get().toBuilder();
            T result = mutation.apply(builder);
            if (builder.isModified()) {
                current.set(builder.build());
            }
            return result;
        } finally {
            writeLock.unlock();
        }
    }

    static String humanize(String key) {
        String spaced = key.replace('_', ' ').replace('-', ' ').trim();
        if (spaced.isEmpty()) {
            return key;
        }
        return Character.toUpperCase(spaced.charAt(0)) + spaced.substring(1);
    }

    private static long asLong(Object value) {
        return value instanceof Number number ? number.longValue() : 0L;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private record Visit(String nodeId, int depth) {}
}
