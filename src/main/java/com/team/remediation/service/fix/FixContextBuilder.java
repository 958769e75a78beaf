package com.team.remediation.service.fix;

import com.team.remediation.config.RemediationConfig;
import com.team.remediation.model.diagnosis.AffectedEntity;
import com.team.remediation.model.diagnosis.DiagnosticBundle;
import com.team.remediation.model.graph.Node;
import com.team.remediation.model.graph.NodeType;
import com.team.remediation.model.graph.Relation;
import com.team.remediation.model.graph.Relationship;
import com.team.remediation.service.graph.KnowledgeGraph;
import com.team.remediation.service.search.SearchHit;
import com.team.remediation.service.search.SimilaritySearch;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;

/**
 * Collects graph and similarity-search context for fix generation.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class FixContextBuilder {

    private final KnowledgeGraph knowledgeGraph;
    private final SimilaritySearch similaritySearch;
    private final RemediationConfig config;

    public FixContext build(AffectedEntity entity, DiagnosticBundle bundle, String patternId, List<String> secondaryPatterns) {
        int limit = config.getMaxContextItems();
        String causeId = NodeType.CAUSE.idFor(patternId);

        List<PriorFix> priorFixes = knowledgeGraph.getRelationships(causeId, Relation.REMEDIATES).stream()
                .map(this::toPriorFix)
                .sorted(Comparator.comparingDouble(PriorFix::successRate).reversed()
                        .thenComparing(Comparator.comparingLong(PriorFix::attemptCount).reversed()))
                .limit(limit)
                .toList();

        List<String> relatedCauses = knowledgeGraph.getRelationships(causeId, Relation.SIMILAR_TO).stream()
                .map(Relationship::targetId)
                .toList();

        List<SearchHit> snippets = searchSafely(query(entity, bundle, patternId), limit);

        log.debug("Context for {} / {}: {} prior fixes, {} snippets, {} related causes",
                entity.getId(), patternId, priorFixes.size(), snippets.size(), relatedCauses.size());
        return new FixContext(entity, bundle, patternId, secondaryPatterns, priorFixes, snippets, relatedCauses);
    }

    private PriorFix toPriorFix(Relationship relationship) {
        String label = knowledgeGraph.getNode(relationship.targetId()).map(Node::label).orElse(relationship.targetId());
        Object lastUsed = relationship.metadata().get(KnowledgeGraph.LAST_USED);
        return new PriorFix(relationship.targetId(), label,
                relationship.longValue(KnowledgeGraph.SUCCESS_COUNT),
                relationship.longValue(KnowledgeGraph.ATTEMPT_COUNT),
                lastUsed != null ? lastUsed.toString() : null);
    }

    private List<SearchHit> searchSafely(String query, int limit) {
        try {
            return similaritySearch.search(query, limit);
        } catch (RuntimeException e) {
            log.warn("Similarity search failed, continuing without snippets: {}", e.getMessage());
            return List.of();
        }
    }

    private static String query(AffectedEntity entity, DiagnosticBundle bundle, String patternId) {
        StringBuilder query = new StringBuilder(patternId.replace('_', ' '));
        if (entity.getReason() != null) {
            query.append(' ').append(entity.getReason());
        }
        if (!bundle.rawSignals().isEmpty()) {
            String last = bundle.rawSignals().get(bundle.rawSignals().size() - 1);
            query.append(' ').append(last, 0, Math.min(last.length(), 300));
        }
        return query.toString();
    }
}
