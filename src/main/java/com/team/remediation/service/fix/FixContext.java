package com.team.remediation.service.fix;

import com.team.remediation.model.diagnosis.AffectedEntity;
import com.team.remediation.model.diagnosis.DiagnosticBundle;
import com.team.remediation.service.search.SearchHit;

import java.util.List;

/**
 * Everything the generator knows about one entity's problem.
 *
 * @param relatedCauses causes linked to the pattern by similar_to edges
 */
public record FixContext(AffectedEntity entity,
                         DiagnosticBundle bundle,
                         String patternId,
                         List<String> secondaryPatterns,
                         List<PriorFix> priorFixes,
                         List<SearchHit> similarSnippets,
                         List<String> relatedCauses) {

    public FixContext {
        secondaryPatterns = secondaryPatterns == null ? List.of() : List.copyOf(secondaryPatterns);
        priorFixes = priorFixes == null ? List.of() : List.copyOf(priorFixes);
        similarSnippets = similarSnippets == null ? List.of() : List.copyOf(similarSnippets);
        relatedCauses = relatedCauses == null ? List.of() : List.copyOf(relatedCauses);
    }

    public double topSimilarity() {
        return similarSnippets.isEmpty() ? 0.0 : similarSnippets.get(0).score();
    }

    public long totalAttempts() {
        return priorFixes.stream().mapToLong(PriorFix::attemptCount).sum();
    }

    public long totalSuccesses() {
        return priorFixes.stream().mapToLong(PriorFix::successCount).sum();
    }
}
