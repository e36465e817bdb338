package com.butterfly.core.viz;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Optional;

/**
 * Renderable form of a cascade network. This is the value handed to storage
 * and rendering; it holds no references into engine state.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CascadeVisualization(
    VisualizationNode rootNode,
    List<VisualizationNode> nodes,
    List<VisualizationConnection> connections,
    TemporalProgression temporalProgression,
    List<CrossRegionRecord> crossRegionEffects,
    List<EmergentOpportunity> emergentOpportunities,
    VisualizationMetadata metadata
) {
    public CascadeVisualization {
        nodes = nodes != null ? List.copyOf(nodes) : List.of();
        connections = connections != null ? List.copyOf(connections) : List.of();
        crossRegionEffects = crossRegionEffects != null ? List.copyOf(crossRegionEffects) : List.of();
        emergentOpportunities = emergentOpportunities != null ? List.copyOf(emergentOpportunities) : List.of();
    }

    public CascadeVisualization withMetadata(VisualizationMetadata metadata) {
        return new CascadeVisualization(rootNode, nodes, connections, temporalProgression,
            crossRegionEffects, emergentOpportunities, metadata);
    }

    public Optional<VisualizationNode> findNode(String id) {
        return nodes.stream().filter(n -> n.id().equals(id)).findFirst();
    }

    public List<VisualizationNode> nodesWithRole(NodeRole role) {
        return nodes.stream().filter(n -> n.role() == role).toList();
    }
}
