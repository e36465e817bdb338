package com.butterfly.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Objects;

/**
 * An effect derived from a parent effect by the cascade.
 * Level 1 effects hang off root consequences, level 2 off level 1 effects, and so on.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CascadingEffect(
    String id,
    String parentEffectId,
    String description,
    ImpactProfile impact,
    double probability,
    long delay,                 // ms after the action before this effect triggers
    int level,
    RelationshipKind origin     // DIRECT or INDIRECT
) implements Effect {

    public CascadingEffect {
        Objects.requireNonNull(impact, "impact");
        probability = RootConsequence.clampProbability(probability);
        delay = Math.max(0, delay);
        origin = origin != null ? origin : RelationshipKind.DIRECT;
    }

    @Override
    public ConsequenceType category() {
        return impact.affectedSystems().isEmpty()
            ? ConsequenceType.WORLD_STATE
            : ConsequenceType.forSystem(impact.affectedSystems().get(0));
    }
}
