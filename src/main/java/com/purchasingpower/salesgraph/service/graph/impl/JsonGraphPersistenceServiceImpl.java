package com.purchasingpower.salesgraph.service.graph.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.purchasingpower.salesgraph.configuration.AppProperties;
import com.purchasingpower.salesgraph.exception.GraphPersistenceException;
import com.purchasingpower.salesgraph.model.graph.GraphSnapshot;
import com.purchasingpower.salesgraph.service.graph.GraphPersistenceService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Stores the graph as one pretty-printed JSON document.
 *
 * <p>Writes go to a temporary file next to the target and are moved into place, so readers
 * never see a half-written snapshot.
 */
@Slf4j
@Service
public class JsonGraphPersistenceServiceImpl implements GraphPersistenceService {

    private final ObjectMapper objectMapper;
    private final Path snapshotFile;

    public JsonGraphPersistenceServiceImpl(ObjectMapper objectMapper, AppProperties appProperties) {
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
        this.snapshotFile = Paths.get(appProperties.getGraph().getSnapshotFile()).toAbsolutePath();
    }

    @Override
    public void save(GraphSnapshot snapshot) {
        Path tempFile = null;
        try {
            Path directory = snapshotFile.getParent();
            if (directory != null) {
                Files.createDirectories(directory);
            }
            tempFile = Files.createTempFile(directory, snapshotFile.getFileName().toString(), ".tmp");
            try (OutputStream out = Files.newOutputStream(tempFile)) {
                objectMapper.writeValue(out, snapshot);
            }
            move(tempFile, snapshotFile);
            log.debug("Saved graph snapshot to {} ({} nodes, {} edges)",
                    snapshotFile, snapshot.getNodes().size(), snapshot.getEdges().size());
        } catch (IOException e) {
            deleteQuietly(tempFile);
            throw new GraphPersistenceException("Failed to save graph snapshot: " + e.getMessage(),
                    snapshotFile.toString(), e);
        }
    }

    @Override
    public Optional<GraphSnapshot> load() {
        if (!Files.exists(snapshotFile)) {
            log.info("No graph snapshot at {}, starting empty", snapshotFile);
            return Optional.empty();
        }
        try {
            GraphSnapshot snapshot = objectMapper.readValue(snapshotFile.toFile(), GraphSnapshot.class);
            log.info("Loaded graph snapshot from {} ({} nodes, {} edges)",
                    snapshotFile, snapshot.getNodes().size(), snapshot.getEdges().size());
            return Optional.of(snapshot);
        } catch (IOException e) {
            throw new GraphPersistenceException("Failed to load graph snapshot: " + e.getMessage(),
                    snapshotFile.toString(), e);
        }
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Could not remove temporary snapshot {}: {}", file, e.getMessage());
        }
    }
}
