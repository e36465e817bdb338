package com.butterfly.core.world;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Abstract subsystem of the simulated world with weighted links to other systems.
 *
 * Influence factors keep their declaration order; expansion walks them in that order.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WorldSystem(
    String id,
    String name,
    List<String> connectedSystems,
    Map<String, Double> influenceFactors    // target system id -> 0..1
) {
    public WorldSystem {
        name = name != null ? name : id;
        connectedSystems = connectedSystems != null ? List.copyOf(connectedSystems) : List.of();
        influenceFactors = influenceFactors != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(influenceFactors))
            : Map.of();
    }

    public double influenceOn(String systemId) {
        return influenceFactors.getOrDefault(systemId, 0.0);
    }
}
