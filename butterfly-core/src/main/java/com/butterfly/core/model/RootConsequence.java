package com.butterfly.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * A first-order consequence of an action, as produced by the text generation
 * service. The cascade starts from these.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RootConsequence(
    String id,
    ConsequenceType type,
    String description,
    ImpactProfile impact,
    double confidence           // 0-1, the consequence's probability
) implements Effect {

    public RootConsequence {
        type = type != null ? type : ConsequenceType.OTHER;
        description = description != null ? description : "";
        impact = impact != null ? impact : new ImpactProfile(null, ImpactProfile.MIN_MAGNITUDE, null, null, null);
        confidence = clampProbability(confidence);
    }

    @Override
    public double probability() {
        return confidence;
    }

    @Override
    public ConsequenceType category() {
        return type;
    }

    static double clampProbability(double value) {
        if (Double.isNaN(value)) return 0.0;
        return Math.max(0.0, Math.min(1.0, value));
    }
}
