package com.butterfly.runner;

import com.butterfly.core.history.EffectHistory;
import com.butterfly.core.history.EffectHistoryStore;
import com.butterfly.core.io.CascadeJson;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Effect histories stored as JSON files, one per history.
 *
 * Directory structure: {baseDir}/{historyId}.json
 */
public class JsonEffectHistoryStore implements EffectHistoryStore {

    private static final Logger log = LoggerFactory.getLogger(JsonEffectHistoryStore.class);
    private static final String EXTENSION = ".json";

    private final Path directory;
    private final ObjectMapper mapper;

    public JsonEffectHistoryStore(Path directory) {
        this.directory = directory;
        this.mapper = CascadeJson.newMapper();
    }

    public Path getDirectory() {
        return directory;
    }

    @Override
    public void save(EffectHistory history) throws IOException {
        Files.createDirectories(directory);
        Path file = fileFor(history.id());
        mapper.writeValue(file.toFile(), history);
        log.info("Saved effect history {} for action {} to: {}", history.id(), history.actionId(), file);
    }

    @Override
    public Optional<EffectHistory> findById(String historyId) throws IOException {
        Path file = fileFor(historyId);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        return Optional.of(mapper.readValue(file.toFile(), EffectHistory.class));
    }

    /**
     * Scans every history file. Unreadable files are logged and skipped.
     */
    @Override
    public List<EffectHistory> findByAction(String actionId) throws IOException {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }

        List<EffectHistory> histories = new ArrayList<>();
        try (Stream<Path> files = Files.list(directory)) {
            for (Path file : files.filter(f -> f.getFileName().toString().endsWith(EXTENSION)).toList()) {
                try {
                    EffectHistory history = mapper.readValue(file.toFile(), EffectHistory.class);
                    if (actionId.equals(history.actionId())) {
                        histories.add(history);
                    }
                } catch (IOException e) {
                    log.error("Failed to load effect history from {}: {}", file, e.getMessage());
                }
            }
        }

        histories.sort(Comparator.comparing(EffectHistory::recordedAt, Comparator.nullsFirst(Comparator.naturalOrder())));
        return histories;
    }

    public boolean exists(String historyId) {
        return Files.exists(fileFor(historyId));
    }

    private Path fileFor(String historyId) {
        if (historyId == null || historyId.isBlank() || historyId.contains("/")
                || historyId.contains("\\") || historyId.contains("..")) {
            throw new IllegalArgumentException("Invalid history id: " + historyId);
        }
        return directory.resolve(historyId + EXTENSION);
    }
}
