package com.butterfly.engine;

import com.butterfly.core.model.CascadingEffect;
import com.butterfly.core.model.EffectRelationship;

import java.util.List;

/**
 * Output of one expansion step: the effects created at {@code level} and their incoming edges.
 */
public record CascadeLevel(
    int level,
    int frontierSize,           // parents expanded to produce this level
    List<CascadingEffect> effects,
    List<EffectRelationship> relationships
) {
    public CascadeLevel {
        effects = List.copyOf(effects);
        relationships = List.copyOf(relationships);
    }

    public boolean isEmpty() {
        return effects.isEmpty();
    }
}
