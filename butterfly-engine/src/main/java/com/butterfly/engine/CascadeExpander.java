package com.butterfly.engine;

import com.butterfly.core.model.CascadeOptions;
import com.butterfly.core.model.CascadingEffect;
import com.butterfly.core.model.Effect;
import com.butterfly.core.model.EffectRelationship;
import com.butterfly.core.model.ImpactProfile;
import com.butterfly.core.model.RelationshipKind;
import com.butterfly.core.world.WorldSystem;
import com.butterfly.core.world.WorldSystemCatalog;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Breadth-first expansion of root consequences into cascading effects.
 *
 * <p>Expansion is lazy: {@link #expand} returns an iterator that computes one
 * level per call, so a caller can stop after any level without paying for the
 * rest. Each level:</p>
 * <ol>
 *   <li>resolves the world systems every frontier effect spreads into,</li>
 *   <li>creates a candidate per influence link above {@code minInfluenceFactor},</li>
 *   <li>drops candidates below {@code probabilityThreshold},</li>
 *   <li>keeps the {@code maxEffectsPerLevel} most probable per parent,</li>
 *   <li>optionally adds weaker indirect effects one hop further, capped in their own pool.</li>
 * </ol>
 *
 * <p>The iterator stops at {@code maxCascadingLevels} or at the first level that yields nothing.
 * The expander itself is stateless and can be shared between threads.</p>
 */
public class CascadeExpander {

    public static final long BASE_DELAY_MS = 2000;
    public static final long LEVEL_DELAY_MS = 1000;
    public static final double DELAY_JITTER_MS = 3000;
    public static final long INDIRECT_EXTRA_DELAY_MS = 2000;
    public static final double INDIRECT_JITTER_MS = 5000;
    public static final double INDIRECT_STRENGTH_FACTOR = 0.5;

    private static final Comparator<CascadingEffect> MOST_PROBABLE_FIRST =
        Comparator.comparingDouble(CascadingEffect::probability).reversed();

    private final WorldSystemCatalog catalog;
    private final ImpactDecayModel decayModel;

    public CascadeExpander(WorldSystemCatalog catalog) {
        this(catalog, new ImpactDecayModel());
    }

    public CascadeExpander(WorldSystemCatalog catalog, ImpactDecayModel decayModel) {
        this.catalog = catalog;
        this.decayModel = decayModel;
    }

    public WorldSystemCatalog getCatalog() {
        return catalog;
    }

    /**
     * Start expanding the given roots. Nothing is computed until the iterator is advanced.
     */
    public Iterator<CascadeLevel> expand(List<? extends Effect> roots, CascadeOptions options, CascadeRandom random) {
        return new Expansion(List.copyOf(roots), options, random);
    }

    /**
     * Base delay of an effect at the given level, before jitter.
     */
    public static long baseDelay(int level) {
        return BASE_DELAY_MS + level * LEVEL_DELAY_MS;
    }

    private final class Expansion implements Iterator<CascadeLevel> {
        private final CascadeOptions options;
        private final CascadeRandom random;
        private final EffectDescriber describer;

        private List<? extends Effect> frontier;
        private int nextLevel = 1;
        private CascadeLevel pending;
        private boolean finished;

        Expansion(List<? extends Effect> roots, CascadeOptions options, CascadeRandom random) {
            this.frontier = roots;
            this.options = options;
            this.random = random;
            this.describer = new EffectDescriber(catalog, random);
        }

        @Override
        public boolean hasNext() {
            if (pending != null) return true;
            if (finished) return false;
            if (nextLevel > options.maxCascadingLevels() || frontier.isEmpty()) {
                finished = true;
                return false;
            }

            CascadeLevel level = expandLevel(frontier, nextLevel);
            if (level.isEmpty()) {
                finished = true;
                return false;
            }
            pending = level;
            frontier = level.effects();
            nextLevel++;
            return true;
        }

        @Override
        public CascadeLevel next() {
            if (!hasNext()) {
                throw new NoSuchElementException("Cascade exhausted after level " + (nextLevel - 1));
            }
            CascadeLevel level = pending;
            pending = null;
            return level;
        }

        private CascadeLevel expandLevel(List<? extends Effect> parents, int level) {
            List<CascadingEffect> effects = new ArrayList<>();
            List<EffectRelationship> relationships = new ArrayList<>();

            for (Effect parent : parents) {
                List<CascadingEffect> direct = strongest(directCandidates(parent, level));
                for (CascadingEffect effect : direct) {
                    effects.add(effect);
                    relationships.add(new EffectRelationship(
                        parent.id(), effect.id(), RelationshipKind.DIRECT, effect.probability(), effect.delay()));
                }

                if (options.includeIndirectEffects() && level < options.maxCascadingLevels()) {
                    List<CascadingEffect> indirect = strongest(indirectCandidates(parent, direct, level));
                    for (CascadingEffect effect : indirect) {
                        effects.add(effect);
                        relationships.add(new EffectRelationship(
                            parent.id(), effect.id(), RelationshipKind.INDIRECT,
                            effect.probability() * INDIRECT_STRENGTH_FACTOR, effect.delay()));
                    }
                }
            }

            return new CascadeLevel(level, parents.size(), effects, relationships);
        }

        /**
         * Threshold filter, then the most probable first (stable for ties), capped.
         */
        private List<CascadingEffect> strongest(List<CascadingEffect> candidates) {
            return candidates.stream()
                .filter(e -> e.probability() >= options.probabilityThreshold())
                .sorted(MOST_PROBABLE_FIRST)
                .limit(options.maxEffectsPerLevel())
                .toList();
        }

        private List<CascadingEffect> directCandidates(Effect parent, int level) {
            List<CascadingEffect> candidates = new ArrayList<>();
            ImpactProfile parentImpact = parent.impact();

            for (WorldSystem system : catalog.systemsInfluencedBy(parent.category(), parentImpact)) {
                for (Map.Entry<String, Double> link : system.influenceFactors().entrySet()) {
                    double factor = link.getValue();
                    if (factor <= options.minInfluenceFactor()) {
                        continue;
                    }
                    String target = link.getKey();
                    long delay = baseDelay(level) + (long) random.jitter(DELAY_JITTER_MS);
                    double probability = Math.min(parent.probability(), decayModel.directProbability(factor, level));
                    ImpactProfile impact = decayModel.decay(parentImpact, level, factor, target);

                    candidates.add(new CascadingEffect(
                        random.nextId(),
                        parent.id(),
                        describer.describeDirect(system.id(), target, impact.severity(), parent.category()),
                        impact,
                        probability,
                        delay,
                        level,
                        RelationshipKind.DIRECT
                    ));
                }
            }
            return candidates;
        }

        private List<CascadingEffect> indirectCandidates(Effect parent, List<CascadingEffect> direct, int level) {
            List<CascadingEffect> candidates = new ArrayList<>();
            for (CascadingEffect effect : direct) {
                for (WorldSystem connected : catalog.connectedSystems(effect.impact().affectedSystems())) {
                    long delay = effect.delay() + INDIRECT_EXTRA_DELAY_MS + (long) random.jitter(INDIRECT_JITTER_MS);
                    candidates.add(new CascadingEffect(
                        random.nextId(),
                        parent.id(),
                        describer.describeIndirect(connected.id()),
                        decayModel.indirect(effect.impact(), connected.id()),
                        decayModel.indirectProbability(effect.probability()),
                        delay,
                        level,
                        RelationshipKind.INDIRECT
                    ));
                }
            }
            return candidates;
        }
    }
}
