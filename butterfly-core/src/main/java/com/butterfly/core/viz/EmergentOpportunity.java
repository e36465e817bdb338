package com.butterfly.core.viz;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Gameplay suggestion arising from two complementary effects.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EmergentOpportunity(
    String id,
    String title,
    String description,
    List<String> requiredConditions,
    List<String> potentialOutcomes,
    List<String> relatedNodeIds
) {
    public EmergentOpportunity {
        requiredConditions = requiredConditions != null ? List.copyOf(requiredConditions) : List.of();
        potentialOutcomes = potentialOutcomes != null ? List.copyOf(potentialOutcomes) : List.of();
        relatedNodeIds = relatedNodeIds != null ? List.copyOf(relatedNodeIds) : List.of();
    }
}
