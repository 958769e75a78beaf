package com.team.remediation.model.diagnosis;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Raw logs and events collected for one entity. Immutable once produced.
 *
 * @param reviewerFeedback feedback from a needs_more_info decision that triggered this re-diagnosis, or null
 */
public record DiagnosticBundle(String entityId,
                               List<String> rawSignals,
                               Instant collectedAt,
                               Map<String, String> metadata,
                               String reviewerFeedback) {

    public DiagnosticBundle {
        Objects.requireNonNull(entityId, "entityId");
        rawSignals = rawSignals == null ? List.of() : List.copyOf(rawSignals);
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static DiagnosticBundle of(String entityId, List<String> rawSignals, Instant collectedAt) {
        return new DiagnosticBundle(entityId, rawSignals, collectedAt, Map.of(), null);
    }

    /**
     * All signals joined and lower-cased, for keyword predicates.
     */
    public String normalizedText() {
        return String.join("\n", rawSignals).toLowerCase();
    }

    public DiagnosticBundle withReviewerFeedback(String feedback) {
        return new DiagnosticBundle(entityId, rawSignals, collectedAt, metadata, feedback);
    }
}
