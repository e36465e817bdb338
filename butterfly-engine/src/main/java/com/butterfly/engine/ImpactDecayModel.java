package com.butterfly.engine;

import com.butterfly.core.model.ImpactProfile;

/**
 * Weakens a parent's impact for the effects it causes.
 *
 * All methods are pure; the expander supplies level and influence factor.
 * Children never hit harder, longer or more broadly than their parent.
 */
public class ImpactDecayModel {

    /** Upper bound of a synthesized probability, before the level divisor. */
    public static final double MAX_DIRECT_PROBABILITY = 0.8;
    public static final double INFLUENCE_PROBABILITY_FACTOR = 0.6;
    public static final double INDIRECT_PROBABILITY_FACTOR = 0.4;
    public static final int INDIRECT_MAGNITUDE_REDUCTION = 2;

    /**
     * Impact of a direct child landing on {@code targetSystemId}.
     *
     * @param parentImpact   impact of the effect being expanded
     * @param level          cascade level of the child (1-based)
     * @param influenceFactor weight of the link being followed (0..1)
     * @param targetSystemId system the child lands on
     */
    public ImpactProfile decay(ImpactProfile parentImpact, int level, double influenceFactor, String targetSystemId) {
        double reduction = 1 + 0.5 * level;
        int magnitude = Math.max(ImpactProfile.MIN_MAGNITUDE,
            (int) Math.floor(parentImpact.magnitude() * clampFactor(influenceFactor) / reduction));

        return ImpactProfile.onSystem(
            parentImpact.severity().weaker(),
            Math.min(magnitude, parentImpact.magnitude()),
            parentImpact.duration().shorter(),
            targetSystemId
        );
    }

    /**
     * Impact of an indirect effect reached one hop past a direct effect.
     */
    public ImpactProfile indirect(ImpactProfile directImpact, String systemId) {
        return ImpactProfile.onSystem(
            directImpact.severity().weaker(),
            Math.max(ImpactProfile.MIN_MAGNITUDE, directImpact.magnitude() - INDIRECT_MAGNITUDE_REDUCTION),
            directImpact.duration().shorter(),
            systemId
        );
    }

    /**
     * {@code min(0.8, factor * 0.6) / level}. Always below 1, falling with level.
     */
    public double directProbability(double influenceFactor, int level) {
        double base = Math.min(MAX_DIRECT_PROBABILITY, clampFactor(influenceFactor) * INFLUENCE_PROBABILITY_FACTOR);
        return base / Math.max(1, level);
    }

    public double indirectProbability(double directProbability) {
        return directProbability * INDIRECT_PROBABILITY_FACTOR;
    }

    private static double clampFactor(double factor) {
        return Math.max(0.0, Math.min(1.0, factor));
    }
}
