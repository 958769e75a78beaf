package com.team.remediation.service.graph;

import com.team.remediation.config.KnowledgeGraphConfig;
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
import com.team.remediation.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

class KnowledgeGraphTest {

    private KnowledgeGraphStore store;
    private KnowledgeGraph graph;

    @BeforeEach
    void setUp() {
        store = mock(KnowledgeGraphStore.class);
        KnowledgeGraphConfig config = new KnowledgeGraphConfig();
        config.setPersistenceEnabled(false);
        graph = new KnowledgeGraph(store, config, MutableClock.at("2026-03-01T10:00:00Z"));
    }

    private static Finding oomFinding(String id) {
        return Finding.builder()
                .id(id)
                .entityId("api-1")
                .description("container killed: OOMKilled")
                .severity("high")
                .detectedAt(Instant.parse("2026-03-01T09:59:00Z"))
                .toolName("kubectl")
                .patternId("resource_exhaustion")
                .build();
    }

    @Test
    void addFindingCreatesCauseEntityToolAndCategory() {
        IngestResult result = graph.addFinding(oomFinding("f-1"), "resource");

        assertThat(result.nodesAdded()).isEqualTo(4);
        assertThat(result.edgesAdded()).isEqualTo(3);
        assertThat(graph.getNode("cause:resource_exhaustion")).map(Node::label).contains("Resource exhaustion");
        assertThat(graph.getRelationships("cause:resource_exhaustion", Relation.INSTANCE_OF))
                .extracting(Relationship::targetId)
                .containsExactly("category:resource");

        List<Relationship> foundIn = graph.getRelationships("cause:resource_exhaustion", Relation.FOUND_IN);
        assertThat(foundIn).hasSize(1);
        assertThat(foundIn.get(0).metadata())
                .containsEntry("finding_id", "f-1")
                .containsEntry("severity", "high")
                .containsEntry("description", "container killed: OOMKilled");
    }

    @Test
    void addingTheSameFindingTwiceChangesNothing() {
        graph.addFinding(oomFinding("f-1"), "resource");
        GraphStats once = graph.stats();

        IngestResult second = graph.addFinding(oomFinding("f-1"), "resource");

        assertThat(second).isEqualTo(IngestResult.NONE);
        assertThat(graph.stats()).isEqualTo(once);
    }

    @Test
    void secondFindingForKnownCauseAddsOnlyItsEdges() {
        graph.addFinding(oomFinding("f-1"), "resource");

        IngestResult second = graph.addFinding(oomFinding("f-2"), "resource");

        assertThat(second.nodesAdded()).isZero();
        assertThat(second.edgesAdded()).isEqualTo(2);
        assertThat(graph.getRelationships("cause:resource_exhaustion", Relation.INSTANCE_OF)).hasSize(1);
    }

    @Test
    void findingWithoutIdIsRejected() {
        Finding finding = oomFinding(null);

        assertThatThrownBy(() -> graph.addFinding(finding)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void traversalTerminatesOnSimilarToCycle() {
        graph.addNode(Node.of(NodeType.CAUSE, "a", "A"));
        graph.addNode(Node.of(NodeType.CAUSE, "b", "B"));
        graph.addNode(Node.of(NodeType.CAUSE, "c", "C"));
        graph.addEdge(Edge.of("cause:a", "cause:b", Relation.SIMILAR_TO));
        graph.addEdge(Edge.of("cause:b", "cause:c", Relation.SIMILAR_TO));
        graph.addEdge(Edge.of("cause:c", "cause:a", Relation.SIMILAR_TO));

        TraversalResult result = graph.traverse("cause:a", 2, Set.of(Relation.SIMILAR_TO));

        assertThat(result.path()).containsExactly("cause:a", "cause:b", "cause:c");
        assertThat(graph.traverse("cause:a", 10, Set.of()).path()).doesNotHaveDuplicates().hasSize(3);
    }

    @Test
    void traversalRespectsDepthAndRelationFilter() {
        graph.addFinding(oomFinding("f-1"), "resource");

        assertThat(graph.traverse("cause:resource_exhaustion", 0, Set.of()).path())
                .containsExactly("cause:resource_exhaustion");
        assertThat(graph.traverse("cause:resource_exhaustion", 1, Set.of(Relation.FOUND_IN)).path())
                .containsExactly("cause:resource_exhaustion", "entity:api-1");
        assertThat(graph.traverse("cause:missing", 2, Set.of()).path()).isEmpty();
    }

    @Test
    void linkSimilarAddsBothDirectionsOnce() {
        graph.addNode(Node.of(NodeType.CAUSE, "a", "A"));
        graph.addNode(Node.of(NodeType.CAUSE, "b", "B"));

        assertThat(graph.linkSimilar("cause:a", "cause:b")).isEqualTo(2);
        assertThat(graph.linkSimilar("cause:b", "cause:a")).isZero();
        assertThat(graph.linkSimilar("cause:a", "cause:a")).isZero();
    }

    @Test
    void findNodesMatchesLabelAndFiltersByType() {
        graph.addFinding(oomFinding("f-1"), "resource");

        assertThat(graph.findNodes("RESOURCE")).extracting(Node::id)
                .containsExactly("cause:resource_exhaustion", "category:resource");
        assertThat(graph.findNodes("resource", NodeType.CATEGORY)).extracting(Node::id)
                .containsExactly("category:resource");
    }

    @Test
    void recordRemediationAccumulatesCounts() {
        Node fix = Node.of(NodeType.FIX, "increase_memory_limit", "Increase memory limit");
        Instant at = Instant.parse("2026-03-01T11:00:00Z");

        graph.recordRemediation("cause:resource_exhaustion", fix, true, at);
        Edge edge = graph.recordRemediation("cause:resource_exhaustion", fix, false, at);

        assertThat(edge.metadata())
                .containsEntry(KnowledgeGraph.SUCCESS_COUNT, 1L)
                .containsEntry(KnowledgeGraph.ATTEMPT_COUNT, 2L)
                .containsEntry(KnowledgeGraph.SUCCESS_RATE, 0.5)
                .containsEntry(KnowledgeGraph.LAST_USED, "2026-03-01T11:00:00Z");
        assertThat(graph.getRelationships("cause:resource_exhaustion", Relation.REMEDIATES)).hasSize(1);
    }

    @Test
    void concurrentRecordRemediationLosesNoAttempts() throws Exception {
        Node fix = Node.of(NodeType.FIX, "restart_workload", "Restart workload");
        int threads = 8;
        int perThread = 50;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            boolean success = t % 2 == 0;
            futures.add(pool.submit(() -> {
                start.await();
                for (int i = 0; i < perThread; i++) {
                    graph.recordRemediation("cause:fatal_crash", fix, success, Instant.now());
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(10, TimeUnit.SECONDS);
        }
        pool.shutdown();

        Relationship edge = graph.getRelationships("cause:fatal_crash", Relation.REMEDIATES).get(0);
        assertThat(edge.longValue(KnowledgeGraph.ATTEMPT_COUNT)).isEqualTo((long) threads * perThread);
        assertThat(edge.longValue(KnowledgeGraph.SUCCESS_COUNT)).isEqualTo((long) threads / 2 * perThread);
    }

    @Test
    void readersSeeEitherOldOrNewSnapshot() {
        GraphSnapshot before = graph.snapshot();
        graph.addFinding(oomFinding("f-1"), "resource");

        assertThat(before.nodeCount()).isZero();
        assertThat(graph.snapshot().nodeCount()).isEqualTo(4);
    }

    @Test
    void persistIsSkippedWhenDisabled() {
        assertThat(graph.persist()).isFalse();
        verifyNoInteractions(store);
    }
}
