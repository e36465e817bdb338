package com.butterfly.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Expanded effect graph for one action.
 * Cascading effects are ordered by level, then by creation.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CascadeNetwork(
    List<RootConsequence> rootConsequences,
    List<CascadingEffect> cascadingEffects,
    List<EffectRelationship> relationships,
    int totalEffects,
    int maxDepthReached,
    long processingDurationMs
) {
    public CascadeNetwork {
        rootConsequences = rootConsequences != null ? List.copyOf(rootConsequences) : List.of();
        cascadingEffects = cascadingEffects != null ? List.copyOf(cascadingEffects) : List.of();
        relationships = relationships != null ? List.copyOf(relationships) : List.of();
    }

    /**
     * Network with the roots only, used when expansion fails.
     */
    public static CascadeNetwork empty(List<RootConsequence> roots, long processingDurationMs) {
        return new CascadeNetwork(roots, List.of(), List.of(), 0, 0, processingDurationMs);
    }

    public boolean hasCascades() {
        return !cascadingEffects.isEmpty();
    }
}
