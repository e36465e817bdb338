package com.butterfly.core.viz;

import com.butterfly.core.model.RelationshipKind;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Directed, timed edge between two visualization nodes.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record VisualizationConnection(
    String id,
    String sourceNodeId,
    String targetNodeId,
    RelationshipKind kind,
    double strength,
    long delay,
    double probability,
    ConnectionVisual visual,
    TemporalWindow window
) {
}
