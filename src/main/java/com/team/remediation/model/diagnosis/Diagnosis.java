package com.team.remediation.model.diagnosis;

import java.util.List;
import java.util.Set;

/**
 * Outcome of the diagnose step for one entity.
 *
 * @param patterns matched pattern ids in rule registration order; empty means manual investigation
 */
public record Diagnosis(AffectedEntity entity, DiagnosticBundle bundle, Set<String> patterns) {

    public boolean hasPattern() {
        return !patterns.isEmpty();
    }

    /**
     * First matching pattern, or null when none matched.
     */
    public String primaryPattern() {
        return patterns.isEmpty() ? null : patterns.iterator().next();
    }

    public List<String> secondaryPatterns() {
        return patterns.stream().skip(1).toList();
    }
}
