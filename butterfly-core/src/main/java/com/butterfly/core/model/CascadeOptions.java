package com.butterfly.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Per-invocation limits for cascade expansion.
 *
 * Negative limits are treated as zero; thresholds are clamped to 0..1.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CascadeOptions(
    int maxCascadingLevels,
    int maxEffectsPerLevel,     // fan-out cap per parent, per pool
    double probabilityThreshold,
    boolean includeIndirectEffects,
    double minInfluenceFactor
) {
    public static final int DEFAULT_MAX_LEVELS = 3;
    public static final int DEFAULT_MAX_EFFECTS_PER_LEVEL = 4;
    public static final double DEFAULT_PROBABILITY_THRESHOLD = 0.3;
    public static final double DEFAULT_MIN_INFLUENCE_FACTOR = 0.3;

    public CascadeOptions {
        maxCascadingLevels = Math.max(0, maxCascadingLevels);
        maxEffectsPerLevel = Math.max(0, maxEffectsPerLevel);
        probabilityThreshold = RootConsequence.clampProbability(probabilityThreshold);
        minInfluenceFactor = RootConsequence.clampProbability(minInfluenceFactor);
    }

    public static CascadeOptions defaults() {
        return new CascadeOptions(
            DEFAULT_MAX_LEVELS,
            DEFAULT_MAX_EFFECTS_PER_LEVEL,
            DEFAULT_PROBABILITY_THRESHOLD,
            true,
            DEFAULT_MIN_INFLUENCE_FACTOR
        );
    }

    public CascadeOptions withMaxCascadingLevels(int levels) {
        return new CascadeOptions(levels, maxEffectsPerLevel, probabilityThreshold, includeIndirectEffects, minInfluenceFactor);
    }

    public CascadeOptions withMaxEffectsPerLevel(int effects) {
        return new CascadeOptions(maxCascadingLevels, effects, probabilityThreshold, includeIndirectEffects, minInfluenceFactor);
    }

    public CascadeOptions withProbabilityThreshold(double threshold) {
        return new CascadeOptions(maxCascadingLevels, maxEffectsPerLevel, threshold, includeIndirectEffects, minInfluenceFactor);
    }

    public CascadeOptions withIndirectEffects(boolean include) {
        return new CascadeOptions(maxCascadingLevels, maxEffectsPerLevel, probabilityThreshold, include, minInfluenceFactor);
    }

    public CascadeOptions withMinInfluenceFactor(double factor) {
        return new CascadeOptions(maxCascadingLevels, maxEffectsPerLevel, probabilityThreshold, includeIndirectEffects, factor);
    }
}
