package com.butterfly.core.history;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Storage collaborator for cascade histories.
 */
public interface EffectHistoryStore {

    void save(EffectHistory history) throws IOException;

    Optional<EffectHistory> findById(String historyId) throws IOException;

    /**
     * Histories recorded for an action, oldest first.
     */
    List<EffectHistory> findByAction(String actionId) throws IOException;

    /**
     * Mark a history as discovered by a player and persist the change.
     *
     * @return the updated history, or empty if no history has that id
     */
    default Optional<EffectHistory> recordDiscovery(String historyId, String playerId) throws IOException {
        Optional<EffectHistory> existing = findById(historyId);
        if (existing.isEmpty()) {
            return Optional.empty();
        }
        EffectHistory updated = existing.get().withDiscovery(playerId);
        if (updated != existing.get()) {
            save(updated);
        }
        return Optional.of(updated);
    }
}
