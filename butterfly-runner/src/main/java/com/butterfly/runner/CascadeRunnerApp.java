package com.butterfly.runner;

import com.butterfly.core.config.EngineConfig;
import com.butterfly.core.history.EffectHistory;
import com.butterfly.core.io.CascadeJson;
import com.butterfly.core.model.CascadeOptions;
import com.butterfly.core.viz.CascadeVisualization;
import com.butterfly.core.world.CatalogConfigurationException;
import com.butterfly.core.world.WorldCatalogLoader;
import com.butterfly.core.world.WorldSystemCatalog;
import com.butterfly.engine.CascadeExpander;
import com.butterfly.engine.NetworkAssembler;
import com.butterfly.engine.viz.VisualizationSynthesizer;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Random;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Cascade Runner - runs one action request through the engine.
 *
 * Usage: CascadeRunnerApp &lt;request.json&gt; [--config engine.yaml] [--out file] [--history dir] [--seed n]
 *
 * The visualization is printed to stdout unless {@code --out} is given, and
 * recorded as an effect history under the history directory.
 */
public class CascadeRunnerApp {
    private static final Logger LOG = LoggerFactory.getLogger(CascadeRunnerApp.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_USAGE = 1;
    public static final int EXIT_IO = 2;

    public static void main(String[] args) {
        int code = run(args, System.out, System.err, Clock.systemUTC());
        if (code != EXIT_OK) {
            System.exit(code);
        }
    }

    static int run(String[] args, PrintStream out, PrintStream err, Clock clock) {
        RunnerArguments arguments;
        try {
            arguments = RunnerArguments.parse(args);
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            printUsage(err);
            return EXIT_USAGE;
        }

        ObjectMapper mapper = CascadeJson.newMapper();
        try {
            EngineConfig config = EngineConfig.load(arguments.configFile());
            CascadeRequest request = CascadeRequest.read(arguments.requestFile(), mapper);
            CascadeOptions options = request.resolveOptions(config.getCascade(), mapper);
            WorldSystemCatalog catalog = loadCatalog(config);

            LOG.info("Running action {} ({} consequences) against {} world systems",
                request.actionId(), request.consequences().size(), catalog.size());

            NetworkAssembler assembler = new NetworkAssembler(
                new CascadeExpander(catalog),
                new VisualizationSynthesizer(),
                randomSource(arguments.seed()),
                clock,
                LoggerFactory.getLogger(NetworkAssembler.class));
            CascadeVisualization visualization = assembler.assemble(
                request.actionId(), request.actionDescription(), request.consequences(), options);

            String json = mapper.writeValueAsString(visualization);
            if (arguments.outFile() != null) {
                Files.writeString(arguments.outFile(), json);
                LOG.info("Wrote visualization to {}", arguments.outFile());
            } else {
                out.println(json);
            }

            Path historyDir = arguments.historyDirectory() != null
                ? arguments.historyDirectory()
                : Path.of(config.getHistoryDirectory());
            EffectHistory history = EffectHistory.record(
                UUID.randomUUID().toString(), request.actionId(), visualization, clock.instant());
            new JsonEffectHistoryStore(historyDir).save(history);
            LOG.info("Recorded history {} with {} persistent effects", history.id(), history.persistentEffectIds().size());
            return EXIT_OK;
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_USAGE;
        } catch (CatalogConfigurationException | IOException e) {
            LOG.error("Cascade run failed: {}", e.getMessage(), e);
            err.println("Error: " + e.getMessage());
            return EXIT_IO;
        }
    }

    private static WorldSystemCatalog loadCatalog(EngineConfig config) {
        WorldCatalogLoader loader = new WorldCatalogLoader();
        return config.hasCustomCatalog()
            ? loader.load(Path.of(config.getCatalogFile()))
            : loader.loadDefault();
    }

    private static Supplier<Random> randomSource(Long seed) {
        if (seed == null) {
            return Random::new;
        }
        long value = seed;
        return () -> new Random(value);
    }

    private static void printUsage(PrintStream err) {
        err.println("Usage: CascadeRunnerApp <request.json> [--config engine.yaml] [--out file] [--history dir] [--seed n]");
        err.println("  --config   YAML file overriding the bundled engine settings");
        err.println("  --out      write the visualization JSON here instead of stdout");
        err.println("  --history  directory for effect history files");
        err.println("  --seed     seed for a repeatable cascade");
    }

    /**
     * Parsed command line.
     */
    record RunnerArguments(Path requestFile, Path configFile, Path outFile, Path historyDirectory, Long seed) {

        static RunnerArguments parse(String[] args) {
            Path request = null;
            Path config = null;
            Path out = null;
            Path history = null;
            Long seed = null;

            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                switch (arg) {
                    case "--config" -> config = Path.of(valueOf(args, ++i, arg));
                    case "--out" -> out = Path.of(valueOf(args, ++i, arg));
                    case "--history" -> history = Path.of(valueOf(args, ++i, arg));
                    case "--seed" -> {
                        String value = valueOf(args, ++i, arg);
                        try {
                            seed = Long.parseLong(value);
                        } catch (NumberFormatException e) {
                            throw new IllegalArgumentException("--seed expects a number, got " + value);
                        }
                    }
                    default -> {
                        if (arg.startsWith("--")) {
                            throw new IllegalArgumentException("Unknown option " + arg);
                        }
                        if (request != null) {
                            throw new IllegalArgumentException("Only one request file may be given");
                        }
                        request = Path.of(arg);
                    }
                }
            }

            if (request == null) {
                throw new IllegalArgumentException("Missing request file");
            }
            return new RunnerArguments(request, config, out, history, seed);
        }

        private static String valueOf(String[] args, int index, String flag) {
            if (index >= args.length) {
                throw new IllegalArgumentException(flag + " needs a value");
            }
            return args[index];
        }
    }
}
