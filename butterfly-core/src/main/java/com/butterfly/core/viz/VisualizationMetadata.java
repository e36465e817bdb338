package com.butterfly.core.viz;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;

/**
 * Summary counts and timing of one cascade run.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record VisualizationMetadata(
    int totalNodes,
    int totalConnections,
    int totalEffects,
    int totalRelationships,
    int maxCascadeDepth,
    long processingTimeMs,
    Instant generatedAt
) {
}
