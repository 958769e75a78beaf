package com.team.remediation.controller;

import com.team.remediation.model.graph.Finding;
import com.team.remediation.model.graph.GraphStats;
import com.team.remediation.model.graph.IngestResult;
import com.team.remediation.model.graph.Node;
import com.team.remediation.model.graph.NodeType;
import com.team.remediation.model.graph.Relation;
import com.team.remediation.model.graph.Relationship;
import com.team.remediation.model.graph.TraversalResult;
import com.team.remediation.service.graph.KnowledgeGraph;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;

/**
 * Read and ingest API of the knowledge graph.
 */
@RestController
@RequestMapping("/api/v1/knowledge")
@Slf4j
@RequiredArgsConstructor
public class KnowledgeGraphController {

    private final KnowledgeGraph knowledgeGraph;

    @GetMapping("/nodes")
    public ResponseEntity<List<Node>> findNodes(@RequestParam(name = "q", defaultValue = "") String query,
                                                @RequestParam(required = false) String type) {
        NodeType nodeType = type != null && !type.isBlank() ? NodeType.fromWireName(type) : null;
        return ResponseEntity.ok(knowledgeGraph.findNodes(query, nodeType));
    }

    @GetMapping("/nodes/{nodeId}")
    public ResponseEntity<Node> getNode(@PathVariable String nodeId) {
        return ResponseEntity.ok(knowledgeGraph.getNode(nodeId)
                .orElseThrow(() -> new NoSuchElementException("Node not found: " + nodeId)));
    }

    /**
     * @param relations comma separated relation names; all relations when omitted
     */
    @GetMapping("/nodes/{nodeId}/traverse")
    public ResponseEntity<TraversalResult> traverse(@PathVariable String nodeId,
                                                    @RequestParam(defaultValue = "2") int depth,
                                                    @RequestParam(required = false) List<String> relations) {
        if (depth < 0) {
            throw new IllegalArgumentException("depth must not be negative");
        }
        Set<Relation> filter = EnumSet.noneOf(Relation.class);
        if (relations != null) {
            relations.stream().filter(r -> !r.isBlank()).map(Relation::fromWireName).forEach(filter::add);
        }
        return ResponseEntity.ok(knowledgeGraph.traverse(nodeId, depth, filter));
    }

    @GetMapping("/nodes/{nodeId}/relationships")
    public ResponseEntity<List<Relationship>> relationships(@PathVariable String nodeId,
                                                            @RequestParam(required = false) String relation) {
        Relation filter = relation != null && !relation.isBlank() ? Relation.fromWireName(relation) : null;
        return ResponseEntity.ok(knowledgeGraph.getRelationships(nodeId, filter));
    }

    @PostMapping("/findings")
    public ResponseEntity<IngestResult> addFinding(@RequestBody Finding finding) {
        if (finding.getId() == null || finding.getId().isBlank() || finding.getEntityId() == null) {
            throw new IllegalArgumentException("finding id and entity_id are required");
        }
        log.info("Ingesting finding {} for {}", finding.getId(), finding.getEntityId());
        return ResponseEntity.ok(knowledgeGraph.addFinding(finding));
    }

    @PostMapping("/persist")
    public ResponseEntity<Map<String, Object>> persist() {
        return ResponseEntity.ok(Map.of("saved", knowledgeGraph.persist()));
    }

    @GetMapping("/stats")
    public ResponseEntity<GraphStats> stats() {
        return ResponseEntity.ok(knowledgeGraph.stats());
    }
}
