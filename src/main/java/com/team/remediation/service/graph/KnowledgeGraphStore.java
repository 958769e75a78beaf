package com.team.remediation.service.graph;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.team.remediation.config.KnowledgeGraphConfig;
import com.team.remediation.exception.GraphPersistenceException;
import com.team.remediation.model.graph.GraphDocument;
import com.team.remediation.model.graph.GraphSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.Optional;

/**
 * Reads and writes the graph snapshot as a self-describing JSON document.
 * Integers are read back as longs so edge metadata round-trips unchanged.
 */
@Component
@Slf4j
public class KnowledgeGraphStore {

    private final ObjectMapper reader;
    private final ObjectMapper writer;
    private final KnowledgeGraphConfig config;

    public KnowledgeGraphStore(ObjectMapper objectMapper, KnowledgeGraphConfig config) {
        this.reader = objectMapper.copy()
                .enable(DeserializationFeature.USE_LONG_FOR_INTS);
        this.writer = objectMapper.copy()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
        this.config = config;
    }

    public Path path() {
        return Path.of(config.getPath());
    }

    /**
     * Write the snapshot to a temp file and move it into place.
     */
    public void save(GraphSnapshot snapshot, Instant savedAt) {
        Path target = path();
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path temp = target.resolveSibling(target.getFileName() + ".tmp");
            writer.writeValue(temp.toFile(), GraphDocument.from(snapshot, savedAt));
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (IOException atomicMoveFailed) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            log.info("Knowledge graph saved to {} ({} nodes, {} edges)",
                    target, snapshot.nodeCount(), snapshot.edgeCount());
        } catch (IOException e) {
            throw new GraphPersistenceException("Failed to save knowledge graph to " + target, e);
        }
    }

    /**
     * @return the stored snapshot, or empty when the file is missing or unreadable
     */
    public Optional<GraphSnapshot> load() {
        Path source = path();
        if (!Files.exists(source)) {
            log.info("No knowledge graph snapshot at {}, starting empty", source);
            return Optional.empty();
        }

        try {
            GraphDocument document = reader.readValue(source.toFile(), GraphDocument.class);
            GraphSnapshot snapshot = document.toSnapshot();
            log.info("Knowledge graph loaded from {} ({} nodes, {} edges, saved at {})",
                    source, snapshot.nodeCount(), snapshot.edgeCount(), document.getSavedAt());
            return Optional.of(snapshot);
        } catch (IOException | RuntimeException e) {
            log.error("Knowledge graph snapshot {} is corrupt, starting empty: {}", source, e.getMessage());
            quarantine(source);
            return Optional.empty();
        }
    }

    private void quarantine(Path corrupt) {
        Path aside = corrupt.resolveSibling(corrupt.getFileName() + ".corrupt-" + System.currentTimeMillis());
        try {
            Files.move(corrupt, aside, StandardCopyOption.REPLACE_EXISTING);
            log.warn("Corrupt snapshot moved to {}", aside);
        } catch (IOException e) {
            log.warn("Could not move corrupt snapshot {} aside: {}", corrupt, e.getMessage());
        }
    }
}
