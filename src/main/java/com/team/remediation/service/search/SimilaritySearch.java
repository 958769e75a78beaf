package com.team.remediation.service.search;

import java.util.List;
import java.util.Map;

/**
 * Free-text similarity search over past remediation summaries.
 */
public interface SimilaritySearch {

    /**
     * @return at most {@code topK} hits, best first, each with a score in [0, 1]
     */
    List<SearchHit> search(String query, int topK);

    /**
     * Add or replace a document.
     */
    void index(String id, String content, Map<String, String> metadata);

    int size();
}
