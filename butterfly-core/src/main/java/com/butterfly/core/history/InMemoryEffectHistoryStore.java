package com.butterfly.core.history;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local history store, for tests and embedding without persistence.
 */
public class InMemoryEffectHistoryStore implements EffectHistoryStore {

    private final Map<String, EffectHistory> histories = new ConcurrentHashMap<>();

    @Override
    public void save(EffectHistory history) {
        histories.put(history.id(), history);
    }

    @Override
    public Optional<EffectHistory> findById(String historyId) {
        return Optional.ofNullable(histories.get(historyId));
    }

    @Override
    public List<EffectHistory> findByAction(String actionId) {
        return histories.values().stream()
            .filter(h -> h.actionId().equals(actionId))
            .sorted(Comparator.comparing(EffectHistory::recordedAt, Comparator.nullsFirst(Comparator.naturalOrder())))
            .toList();
    }

    public int size() {
        return histories.size();
    }
}
