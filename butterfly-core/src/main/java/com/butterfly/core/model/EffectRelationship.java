package com.butterfly.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Directed edge from a parent effect to a child effect.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EffectRelationship(
    String parentId,
    String childId,
    RelationshipKind kind,
    double strength,            // 0-1
    long delay                  // ms
) {
}
