package com.butterfly.core.history;

import com.butterfly.core.model.DurationClass;
import com.butterfly.core.viz.CascadeVisualization;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Stored record of one action's cascade, with the players who have discovered it.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EffectHistory(
    String id,
    String actionId,
    Instant recordedAt,
    CascadeVisualization visualization,
    List<String> persistentEffectIds,   // nodes that outlive the action
    List<String> discoveredBy,
    boolean achievementUnlocked
) {
    /** Magnitude from which an effect is remembered regardless of its duration. */
    public static final int PERSISTENT_MAGNITUDE = 8;
    /** Number of distinct discoverers that unlocks the achievement. */
    public static final int ACHIEVEMENT_DISCOVERIES = 5;

    public EffectHistory {
        persistentEffectIds = persistentEffectIds != null ? List.copyOf(persistentEffectIds) : List.of();
        discoveredBy = discoveredBy != null ? List.copyOf(discoveredBy) : List.of();
    }

    public static EffectHistory record(String id, String actionId, CascadeVisualization visualization, Instant recordedAt) {
        List<String> persistent = visualization.nodes().stream()
            .filter(n -> n.metadata().duration() == DurationClass.PERMANENT
                || n.metadata().magnitude() >= PERSISTENT_MAGNITUDE)
            .map(n -> n.id())
            .toList();
        return new EffectHistory(id, actionId, recordedAt, visualization, persistent, List.of(), false);
    }

    /**
     * Copy with the player added to the discoverers. A player is only counted once.
     */
    public EffectHistory withDiscovery(String playerId) {
        if (playerId == null || discoveredBy.contains(playerId)) {
            return this;
        }
        List<String> players = new ArrayList<>(discoveredBy);
        players.add(playerId);
        boolean unlocked = achievementUnlocked || players.size() >= ACHIEVEMENT_DISCOVERIES;
        return new EffectHistory(id, actionId, recordedAt, visualization, persistentEffectIds, players, unlocked);
    }
}
