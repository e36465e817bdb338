package com.butterfly.runner;

import com.butterfly.core.history.EffectHistory;
import com.butterfly.core.model.DurationClass;
import com.butterfly.core.model.SeverityLevel;
import com.butterfly.core.viz.CascadeVisualization;
import com.butterfly.core.viz.NodeMetadata;
import com.butterfly.core.viz.NodePosition;
import com.butterfly.core.viz.NodeRole;
import com.butterfly.core.viz.NodeVisual;
import com.butterfly.core.viz.VisualizationNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the file-backed history store.
 */
class JsonEffectHistoryStoreTest {

    private static final Instant RECORDED = Instant.parse("2026-03-01T10:15:30Z");

    @TempDir
    Path tempDir;

    private JsonEffectHistoryStore store;

    @BeforeEach
    void setUp() {
        store = new JsonEffectHistoryStore(tempDir.resolve("history"));
    }

    private static CascadeVisualization visualization() {
        VisualizationNode action = new VisualizationNode("a1", NodeRole.ACTION, NodePosition.ORIGIN,
            new NodeMetadata("Player Action", "Player opens the dam", SeverityLevel.MINOR, 1.0,
                List.of(), List.of(), DurationClass.TEMPORARY, 1),
            new NodeVisual("#4CAF50", 20, 1.0, 2.0));
        VisualizationNode flood = new VisualizationNode("c1", NodeRole.CONSEQUENCE, new NodePosition(150, 0, 1),
            new NodeMetadata("Environmental Effect", "The valley floods", SeverityLevel.CRITICAL, 0.9,
                List.of("environment"), List.of("river", "village"), DurationClass.PERMANENT, 9),
            new NodeVisual("#4CAF50", 27, 0.9, 3.0));
        return new CascadeVisualization(action, List.of(action, flood), null, null, null, null, null);
    }

    @Test
    @DisplayName("Saves one JSON file per history and reads it back")
    void saveAndLoad() throws Exception {
        EffectHistory history = EffectHistory.record("h1", "a1", visualization(), RECORDED);

        store.save(history);

        assertTrue(Files.exists(tempDir.resolve("history/h1.json")));
        assertTrue(store.exists("h1"));
        assertEquals(history, store.findById("h1").orElseThrow());
        assertEquals(List.of("c1"), store.findById("h1").orElseThrow().persistentEffectIds());
    }

    @Test
    @DisplayName("Missing histories and directories are empty results")
    void missing() throws Exception {
        assertTrue(store.findById("nope").isEmpty());
        assertTrue(store.findByAction("a1").isEmpty());
    }

    @Test
    @DisplayName("Finds an action's histories oldest first and skips unreadable files")
    void findByAction() throws Exception {
        store.save(EffectHistory.record("h2", "a1", visualization(), RECORDED.plusSeconds(30)));
        store.save(EffectHistory.record("h1", "a1", visualization(), RECORDED));
        store.save(EffectHistory.record("h3", "a2", visualization(), RECORDED));
        Files.writeString(tempDir.resolve("history/broken.json"), "{ not json");

        List<String> ids = store.findByAction("a1").stream().map(EffectHistory::id).toList();

        assertEquals(List.of("h1", "h2"), ids);
    }

    @Test
    @DisplayName("Discoveries are written back to disk")
    void recordDiscovery() throws Exception {
        store.save(EffectHistory.record("h1", "a1", visualization(), RECORDED));
        for (int i = 1; i <= 5; i++) {
            store.recordDiscovery("h1", "player-" + i);
        }
        store.recordDiscovery("h1", "player-1");

        EffectHistory reloaded = new JsonEffectHistoryStore(tempDir.resolve("history")).findById("h1").orElseThrow();
        assertEquals(5, reloaded.discoveredBy().size());
        assertTrue(reloaded.achievementUnlocked());
    }

    @Test
    @DisplayName("Rejects ids that would escape the directory")
    void rejectsPathIds() {
        assertThrows(IllegalArgumentException.class, () -> store.findById("../secrets"));
        assertThrows(IllegalArgumentException.class, () -> store.exists("a/b"));
    }
}
