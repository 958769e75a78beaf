package com.team.remediation.service.learning;

import com.team.remediation.model.graph.Node;
import com.team.remediation.model.graph.NodeType;
import com.team.remediation.model.proposal.FixProposal;
import com.team.remediation.service.graph.KnowledgeGraph;
import com.team.remediation.service.search.SimilaritySearch;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Writes remediation outcomes back into the knowledge graph and the similarity index.
 * Every write is best-effort: failures are logged and never reach the workflow.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class LearningStore {

    private final KnowledgeGraph knowledgeGraph;
    private final SimilaritySearch similaritySearch;

    public void record(RemediationOutcome outcome) {
        FixProposal proposal = outcome.proposal();
        String patternId = outcome.patternId() != null ? outcome.patternId() : proposal.getPatternId();
        String fixKey = proposal.getFixId() != null ? proposal.getFixId() : "unnamed_fix";

        try {
            Node fixNode = Node.of(NodeType.FIX, fixKey, label(fixKey), fixAttributes(proposal));
            knowledgeGraph.recordRemediation(NodeType.CAUSE.idFor(patternId), fixNode, outcome.success(), outcome.recordedAt());
            log.info("[{}] Learned {} outcome of {} for {}", proposal.getWorkflowId(),
                    outcome.success() ? "successful" : "failed", fixKey, patternId);
        } catch (RuntimeException e) {
            log.warn("[{}] Could not record outcome of {} in knowledge graph: {}",
                    proposal.getWorkflowId(), proposal.getId(), e.getMessage());
        }

        try {
            Map<String, String> metadata = new LinkedHashMap<>();
            metadata.put("pattern_id", patternId);
            metadata.put("fix_id", fixKey);
            metadata.put("success", String.valueOf(outcome.success()));
            if (outcome.entityScope() != null) {
                metadata.put("scope", outcome.entityScope());
            }
            similaritySearch.index("outcome:" + proposal.getId(), summary(outcome, patternId, fixKey), metadata);
        } catch (RuntimeException e) {
            log.warn("[{}] Could not index outcome of {}: {}", proposal.getWorkflowId(), proposal.getId(), e.getMessage());
        }
    }

    /**
     * Record each outcome, then save the graph once.
     */
    public void recordAll(List<RemediationOutcome> outcomes) {
        if (outcomes.isEmpty()) {
            return;
        }
        outcomes.forEach(this::record);
        knowledgeGraph.persist();
    }

    static String summary(RemediationOutcome outcome, String patternId, String fixKey) {
        FixProposal proposal = outcome.proposal();
        return String.format(Locale.ROOT, "%s on %s%s: %s (%s) %s. Root cause: %s. Action: %s.%s",
                patternId.replace('_', ' '),
                proposal.getEntityId(),
                outcome.entityScope() != null ? " in " + outcome.entityScope() : "",
                fixKey.replace('_', ' '),
                proposal.getRiskLevel(),
                outcome.success() ? "succeeded" : "failed",
                proposal.getRootCause(),
                proposal.getProposedAction() != null ? proposal.getProposedAction().description() : "n/a",
                outcome.detail() != null && !outcome.detail().isBlank() ? " Detail: " + outcome.detail() : "");
    }

    private static Map<String, String> fixAttributes(FixProposal proposal) {
        Map<String, String> attributes = new LinkedHashMap<>();
        if (proposal.getRiskLevel() != null) {
            attributes.put("risk_level", proposal.getRiskLevel().name());
        }
        if (proposal.getProposedAction() != null) {
            attributes.put("example_command", proposal.getProposedAction().commandLine());
        }
        return attributes;
    }

    private static String label(String fixKey) {
        String spaced = fixKey.replace('_', ' ');
        return Character.toUpperCase(spaced.charAt(0)) + spaced.substring(1);
    }
}
