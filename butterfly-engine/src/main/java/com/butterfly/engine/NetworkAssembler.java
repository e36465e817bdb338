package com.butterfly.engine;

import com.butterfly.core.model.CascadeNetwork;
import com.butterfly.core.model.CascadeOptions;
import com.butterfly.core.model.CascadingEffect;
import com.butterfly.core.model.RootConsequence;
import com.butterfly.core.viz.CascadeVisualization;
import com.butterfly.core.viz.VisualizationMetadata;
import com.butterfly.core.world.WorldSystemCatalog;
import com.butterfly.engine.viz.VisualizationSynthesizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Random;
import java.util.function.Supplier;

/**
 * Entry point of the engine: expands an action's root consequences and turns
 * the result into a {@link CascadeVisualization}.
 *
 * <p>This class is data-source agnostic and keeps no per-call state; one
 * instance can serve concurrent actions. Each call draws a fresh
 * {@link Random} from the supplied source, so a seeded supplier makes runs
 * repeatable.</p>
 *
 * <p>If expansion throws, the failure is logged and the caller gets a network
 * holding only the root consequences. A partially expanded graph is never returned.</p>
 */
public class NetworkAssembler {

    private final CascadeExpander expander;
    private final VisualizationSynthesizer synthesizer;
    private final Supplier<Random> randomSource;
    private final Clock clock;
    private final Logger log;

    public NetworkAssembler(WorldSystemCatalog catalog) {
        this(new CascadeExpander(catalog), new VisualizationSynthesizer(), Random::new,
            Clock.systemUTC(), LoggerFactory.getLogger(NetworkAssembler.class));
    }

    public NetworkAssembler(CascadeExpander expander, VisualizationSynthesizer synthesizer,
                            Supplier<Random> randomSource, Clock clock, Logger log) {
        this.expander = expander;
        this.synthesizer = synthesizer;
        this.randomSource = randomSource;
        this.clock = clock;
        this.log = log;
    }

    /**
     * Expanded network plus the ledger that resolves its edges.
     */
    private record Expansion(CascadeNetwork network, RelationshipLedger ledger) {}

    public CascadeVisualization assemble(String actionId, String actionDescription, List<RootConsequence> roots) {
        return assemble(actionId, actionDescription, roots, CascadeOptions.defaults());
    }

    /**
     * Run the whole pipeline for one action.
     *
     * @param actionId          id of the action; becomes the root node id
     * @param actionDescription human-readable action text
     * @param roots             consequences produced for the action, in display order
     * @param options           limits for this invocation
     */
    public CascadeVisualization assemble(String actionId, String actionDescription,
                                         List<RootConsequence> roots, CascadeOptions options) {
        long startNanos = System.nanoTime();
        CascadeRandom random = new CascadeRandom(randomSource.get());

        Expansion expansion = expand(actionId, safeRoots(roots), options, random, startNanos);
        CascadeVisualization visualization = synthesizer.synthesize(
            actionId, actionDescription, expansion.network(), expansion.ledger(), random);

        CascadeNetwork network = expansion.network();
        VisualizationMetadata metadata = new VisualizationMetadata(
            visualization.nodes().size(),
            visualization.connections().size(),
            network.totalEffects(),
            network.relationships().size(),
            network.maxDepthReached(),
            elapsedMs(startNanos),
            clock.instant()
        );

        log.info("Cascade for action {} ready: {} nodes, {} connections, {} opportunities in {} ms",
            actionId, metadata.totalNodes(), metadata.totalConnections(),
            visualization.emergentOpportunities().size(), metadata.processingTimeMs());
        return visualization.withMetadata(metadata);
    }

    public CascadeNetwork buildNetwork(String actionId, List<RootConsequence> roots, CascadeOptions options) {
        long startNanos = System.nanoTime();
        return expand(actionId, safeRoots(roots), options, new CascadeRandom(randomSource.get()), startNanos).network();
    }

    private Expansion expand(String actionId, List<RootConsequence> roots, CascadeOptions options,
                             CascadeRandom random, long startNanos) {
        log.info("Starting cascade for action {} with {} root consequences (max {} levels, {} effects per level)",
            actionId, roots.size(), options.maxCascadingLevels(), options.maxEffectsPerLevel());

        RelationshipLedger ledger = new RelationshipLedger();
        List<CascadingEffect> effects = new ArrayList<>();
        int depth = 0;

        try {
            Iterator<CascadeLevel> levels = expander.expand(roots, options, random);
            while (levels.hasNext()) {
                CascadeLevel level = levels.next();
                effects.addAll(level.effects());
                ledger.appendAll(level.relationships());
                depth = level.level();
                log.debug("Action {} level {}: {} effects from {} parents",
                    actionId, level.level(), level.effects().size(), level.frontierSize());
            }
        } catch (RuntimeException e) {
            long elapsed = elapsedMs(startNanos);
            log.atError()
                .setCause(e)
                .addKeyValue("actionId", actionId)
                .addKeyValue("levelReached", depth)
                .addKeyValue("effectsSoFar", effects.size())
                .addKeyValue("elapsedMs", elapsed)
                .log("Cascade expansion failed for action {}, returning empty network", actionId);
            return new Expansion(CascadeNetwork.empty(roots, elapsed), new RelationshipLedger());
        }

        CascadeNetwork network = new CascadeNetwork(
            roots, effects, ledger.edges(), effects.size(), depth, elapsedMs(startNanos));
        log.info("Cascade for action {} expanded: {} effects, depth {}", actionId, network.totalEffects(), depth);
        return new Expansion(network, ledger);
    }

    private static List<RootConsequence> safeRoots(List<RootConsequence> roots) {
        return roots != null ? List.copyOf(roots) : List.of();
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
