package com.butterfly.runner;

import com.butterfly.core.config.EngineConfig;
import com.butterfly.core.io.CascadeJson;
import com.butterfly.core.model.CascadeOptions;
import com.butterfly.core.model.ConsequenceType;
import com.butterfly.core.model.DurationClass;
import com.butterfly.core.viz.CascadeVisualization;
import com.butterfly.core.viz.NodeRole;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for request parsing and the command line driver.
 */
class CascadeRunnerAppTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T10:15:30Z"), ZoneOffset.UTC);

    private static final String REQUEST = """
        {
          "actionId": "burn-granary",
          "actionDescription": "Player burns the granary",
          "consequences": [
            {
              "id": "c1",
              "type": "economic",
              "description": "Grain prices soar",
              "confidence": 0.9,
              "impact": {
                "severity": "major",
                "magnitude": 8,
                "duration": "long",
                "affectedSystems": ["economic"],
                "affectedRegions": ["village", "market"]
              }
            },
            {
              "id": "c2",
              "type": "social",
              "description": "Villagers gather in anger",
              "confidence": 0.7,
              "impact": { "severity": "moderate", "magnitude": 5 }
            }
          ],
          "options": { "maxCascadingLevels": 2, "probabilityThreshold": 0.1 }
        }
        """;

    @TempDir
    Path tempDir;

    private Path requestFile;
    private ByteArrayOutputStream stdout;
    private ByteArrayOutputStream stderr;

    @BeforeEach
    void setUp() throws Exception {
        requestFile = Files.writeString(tempDir.resolve("request.json"), REQUEST);
        stdout = new ByteArrayOutputStream();
        stderr = new ByteArrayOutputStream();
    }

    private int run(String... args) {
        return CascadeRunnerApp.run(args,
            new PrintStream(stdout, true, StandardCharsets.UTF_8),
            new PrintStream(stderr, true, StandardCharsets.UTF_8),
            CLOCK);
    }

    @Nested
    @DisplayName("Request Parsing")
    class RequestTests {

        @Test
        @DisplayName("Reads consequences with lenient enum spellings")
        void readsRequest() throws Exception {
            CascadeRequest request = CascadeRequest.read(requestFile, CascadeJson.newMapper());

            assertEquals("burn-granary", request.actionId());
            assertEquals(2, request.consequences().size());
            assertEquals(ConsequenceType.ECONOMIC, request.consequences().get(0).type());
            assertEquals(DurationClass.LONG_TERM, request.consequences().get(0).impact().duration());
            assertEquals(DurationClass.SHORT_TERM, request.consequences().get(1).impact().duration());
        }

        @Test
        @DisplayName("Request options override only the limits they name")
        void partialOptions() throws Exception {
            CascadeRequest request = CascadeRequest.read(requestFile, CascadeJson.newMapper());
            EngineConfig.CascadeSettings defaults = new EngineConfig.CascadeSettings();

            CascadeOptions options = request.resolveOptions(defaults, CascadeJson.newMapper());

            assertEquals(2, options.maxCascadingLevels());
            assertEquals(0.1, options.probabilityThreshold());
            assertEquals(4, options.maxEffectsPerLevel());
            assertTrue(options.includeIndirectEffects());
            assertEquals(3, defaults.getMaxCascadingLevels(), "Defaults stay untouched");
        }

        @Test
        @DisplayName("Without options the configured defaults apply")
        void noOptions() throws Exception {
            Path file = Files.writeString(tempDir.resolve("bare.json"), "{ \"actionId\": \"a1\" }");

            CascadeRequest request = CascadeRequest.read(file, CascadeJson.newMapper());

            assertTrue(request.consequences().isEmpty());
            assertEquals("", request.actionDescription());
            assertEquals(CascadeOptions.defaults(),
                request.resolveOptions(new EngineConfig.CascadeSettings(), CascadeJson.newMapper()));
        }

        @Test
        @DisplayName("A request without an action id is rejected")
        void missingActionId() throws Exception {
            Path file = Files.writeString(tempDir.resolve("anonymous.json"), "{ \"consequences\": [] }");

            assertThrows(IllegalArgumentException.class, () -> CascadeRequest.read(file, CascadeJson.newMapper()));
        }
    }

    @Nested
    @DisplayName("Command Line")
    class CommandLineTests {

        @Test
        @DisplayName("Writes the visualization and records a history")
        void fullRun() throws Exception {
            Path out = tempDir.resolve("viz.json");
            Path history = tempDir.resolve("history");

            int code = run(requestFile.toString(), "--out", out.toString(), "--history", history.toString(), "--seed", "7");

            assertEquals(CascadeRunnerApp.EXIT_OK, code, stderr.toString(StandardCharsets.UTF_8));
            CascadeVisualization viz = CascadeJson.read(Files.readString(out));
            assertEquals("burn-granary", viz.rootNode().id());
            assertEquals(2, viz.nodesWithRole(NodeRole.CONSEQUENCE).size());
            assertEquals(CLOCK.instant(), viz.metadata().generatedAt());
            assertTrue(viz.metadata().maxCascadeDepth() <= 2);
            assertEquals(1, viz.crossRegionEffects().size());

            try (Stream<Path> files = Files.list(history)) {
                assertEquals(1, files.filter(f -> f.toString().endsWith(".json")).count());
            }
            assertEquals(1, new JsonEffectHistoryStore(history).findByAction("burn-granary").size());
        }

        @Test
        @DisplayName("Prints to stdout without --out, repeatably for a fixed seed")
        void printsToStdout() throws Exception {
            String history = tempDir.resolve("history").toString();

            assertEquals(CascadeRunnerApp.EXIT_OK, run(requestFile.toString(), "--history", history, "--seed", "11"));
            CascadeVisualization first = CascadeJson.read(stdout.toString(StandardCharsets.UTF_8));

            stdout.reset();
            assertEquals(CascadeRunnerApp.EXIT_OK, run(requestFile.toString(), "--history", history, "--seed", "11"));
            CascadeVisualization second = CascadeJson.read(stdout.toString(StandardCharsets.UTF_8));

            assertEquals(first.withMetadata(null), second.withMetadata(null));
        }

        @Test
        @DisplayName("Config file supplies defaults for limits the request leaves out")
        void configFile() throws Exception {
            Path config = Files.writeString(tempDir.resolve("engine.yaml"), """
                cascade:
                  maxCascadingLevels: 0
                """);
            Path bare = Files.writeString(tempDir.resolve("bare.json"), """
                { "actionId": "a1", "consequences": [ { "id": "c1", "type": "combat", "confidence": 0.9,
                  "impact": { "magnitude": 8 } } ] }
                """);
            Path out = tempDir.resolve("viz.json");

            int code = run(bare.toString(), "--config", config.toString(), "--out", out.toString(),
                "--history", tempDir.resolve("history").toString());

            assertEquals(CascadeRunnerApp.EXIT_OK, code);
            assertEquals(2, CascadeJson.read(Files.readString(out)).nodes().size());
        }

        @Test
        @DisplayName("Usage errors exit with 1")
        void usageErrors() {
            assertEquals(CascadeRunnerApp.EXIT_USAGE, run());
            assertEquals(CascadeRunnerApp.EXIT_USAGE, run(requestFile.toString(), "--seed", "soon"));
            assertEquals(CascadeRunnerApp.EXIT_USAGE, run(requestFile.toString(), "--out"));
            assertEquals(CascadeRunnerApp.EXIT_USAGE, run(requestFile.toString(), "--verbose"));
            assertTrue(stderr.toString(StandardCharsets.UTF_8).contains("Usage:"));
        }

        @Test
        @DisplayName("Unreadable input exits with 2")
        void ioErrors() throws Exception {
            assertEquals(CascadeRunnerApp.EXIT_IO, run(tempDir.resolve("missing.json").toString()));

            Path garbage = Files.writeString(tempDir.resolve("garbage.json"), "{ \"actionId\": ");
            assertEquals(CascadeRunnerApp.EXIT_IO, run(garbage.toString()));
        }
    }
}
