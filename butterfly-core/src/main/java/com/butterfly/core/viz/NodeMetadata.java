package com.butterfly.core.viz;

import com.butterfly.core.model.DurationClass;
import com.butterfly.core.model.SeverityLevel;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Display metadata shown for a node.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record NodeMetadata(
    String title,
    String description,
    SeverityLevel severity,
    double confidence,
    List<String> affectedSystems,
    List<String> affectedRegions,
    DurationClass duration,
    int magnitude
) {
    public NodeMetadata {
        affectedSystems = affectedSystems != null ? List.copyOf(affectedSystems) : List.of();
        affectedRegions = affectedRegions != null ? List.copyOf(affectedRegions) : List.of();
    }
}
