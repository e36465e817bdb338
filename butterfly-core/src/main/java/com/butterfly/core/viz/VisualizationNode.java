package com.butterfly.core.viz;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One node of the rendered cascade: the action, a root consequence or a cascading effect.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record VisualizationNode(
    String id,
    NodeRole role,
    NodePosition position,
    NodeMetadata metadata,
    NodeVisual visual
) {
}
