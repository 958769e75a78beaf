package com.team.remediation.service.graph;

import com.team.remediation.config.KnowledgeGraphConfig;
import com.team.remediation.model.graph.Edge;
import com.team.remediation.model.graph.Node;
import com.team.remediation.model.graph.NodeType;
import com.team.remediation.model.graph.Relation;
import com.team.remediation.service.diagnosis.PatternDetector;
import com.team.remediation.service.diagnosis.PatternRule;
import com.team.remediation.service.fix.FallbackRuleTable;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Seeds base knowledge into an empty graph: categories, a cause per registered pattern,
 * the diagnostic tools and the baseline fixes of the fallback rule table.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class KnowledgeGraphSeeder {

    static final List<String> BASE_TOOLS = List.of("kubectl", "kube-events", "trivy", "opa");

    private final KnowledgeGraph knowledgeGraph;
    private final PatternDetector patternDetector;
    private final FallbackRuleTable fallbackRuleTable;
    private final KnowledgeGraphConfig config;

    @PostConstruct
    public void seedIfEmpty() {
        if (!config.isSeedOnEmpty()) {
            return;
        }
        if (knowledgeGraph.snapshot().nodeCount() > 0) {
            log.debug("Knowledge graph already holds {} nodes, not seeding", knowledgeGraph.snapshot().nodeCount());
            return;
        }
        int added = seed();
        log.info("Seeded knowledge graph with {} base nodes", added);
        knowledgeGraph.persist();
    }

    /**
     * @return number of nodes added
     */
    public int seed() {
        return knowledgeGraph.write(graph -> {
            for (PatternRule rule : patternDetector.rules()) {
                Node category = Node.of(NodeType.CATEGORY, rule.category(), KnowledgeGraph.humanize(rule.category()));
                Node cause = Node.of(NodeType.CAUSE, rule.id(), KnowledgeGraph.humanize(rule.id()),
                        Map.of("description", rule.description()));
                graph.addNode(category);
                graph.addNode(cause);
                graph.addEdgeIfAbsent(Edge.of(cause.id(), category.id(), Relation.INSTANCE_OF));
            }

            for (String tool : BASE_TOOLS) {
                graph.addNode(Node.of(NodeType.TOOL, tool, tool));
            }

            for (FallbackRuleTable.Rule rule : fallbackRuleTable.rules()) {
                Node fix = Node.of(NodeType.FIX, rule.fixId(), rule.fixLabel(),
                        Map.of("risk_level", rule.riskLevel().name(), "source", "baseline"));
                graph.addNode(fix);

                String causeId = NodeType.CAUSE.idFor(rule.patternId());
                if (graph.containsNode(causeId)) {
                    Map<String, Object> metadata = new LinkedHashMap<>();
                    metadata.put(KnowledgeGraph.SUCCESS_COUNT, 0L);
                    metadata.put(KnowledgeGraph.ATTEMPT_COUNT, 0L);
                    metadata.put("source", "baseline");
                    graph.addEdgeIfAbsent(new Edge(causeId, fix.id(), Relation.REMEDIATES, metadata));
                }
            }
            return graph.nodesAdded();
        });
    }
}
