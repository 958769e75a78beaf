package com.team.remediation.model.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Structured issue record produced by a diagnostic tool or scanner.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Finding {

    private String id;
    private String entityId;
    private String description;
    private String severity;
    private Instant detectedAt;
    private String toolName;

    /** Causal pattern the finding is an instance of; "unknown" when not classified */
    private String patternId;
}
