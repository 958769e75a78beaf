package com.team.remediation.service.search;

import java.util.Map;

/**
 * One ranked snippet returned by a similarity search.
 */
public record SearchHit(String id, String content, double score, Map<String, String> metadata) {

    public SearchHit {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}
