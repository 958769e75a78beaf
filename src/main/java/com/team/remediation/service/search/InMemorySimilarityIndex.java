package com.team.remediation.service.search;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local similarity index scoring documents by cosine similarity of term-frequency vectors.
 */
@Component
@Slf4j
public class InMemorySimilarityIndex implements SimilaritySearch {

    private final Map<String, IndexedDocument> documents = new ConcurrentHashMap<>();

    @Override
    public List<SearchHit> search(String query, int topK) {
        if (query == null || query.isBlank() || topK <= 0 || documents.isEmpty()) {
            return List.of();
        }
        Map<String, Integer> queryVector = termFrequencies(query);
        return documents.values().stream()
                .map(doc -> new SearchHit(doc.id(), doc.content(), cosineSimilarity(queryVector, doc.terms()), doc.metadata()))
                .filter(hit -> hit.score() > 0.0)
                .sorted((a, b) -> {
                    int byScore = Double.compare(b.score(), a.score());
                    return byScore != 0 ? byScore : a.id().compareTo(b.id());
                })
                .limit(topK)
                .toList();
    }

    @Override
    public void index(String id, String content, Map<String, String> metadata) {
        if (id == null || content == null || content.isBlank()) {
            throw new IllegalArgumentException("Document id and content are required");
        }
        documents.put(id, new IndexedDocument(id, content, termFrequencies(content), metadata == null ? Map.of() : Map.copyOf(metadata)));
        log.debug("Indexed document {} ({} chars)", id, content.length());
    }

    @Override
    public int size() {
        return documents.size();
    }

    static Map<String, Integer> termFrequencies(String text) {
        Map<String, Integer> terms = new HashMap<>();
        for (String token : text.toLowerCase(Locale.ROOT).split("[^a-z0-9_]+")) {
            if (token.length() > 1) {
                terms.merge(token, 1, Integer::sum);
            }
        }
        return terms;
    }

    private static double cosineSimilarity(Map<String, Integer> a, Map<String, Integer> b) {
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        double dotProduct = 0.0;
        for (Map.Entry<String, Integer> term : a.entrySet()) {
            Integer other = b.get(term.getKey());
            if (other != null) {
                dotProduct += (double) term.getValue() * other;
            }
        }
        if (dotProduct == 0.0) {
            return 0.0;
        }
        return dotProduct / (norm(a) * norm(b));
    }

    private static double norm(Map<String, Integer> vector) {
        double sum = 0.0;
        for (int count : vector.values()) {
            sum += (double) count * count;
        }
        return Math.sqrt(sum);
    }

    private record IndexedDocument(String id, String content, Map<String, Integer> terms, Map<String, String> metadata) {
    }
}
