package com.butterfly.engine;

import com.butterfly.core.model.EffectRelationship;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Append-only record of accepted parent to child edges.
 * Entries are never changed or removed; a child has exactly one parent.
 */
public class RelationshipLedger {

    private final List<EffectRelationship> edges = new ArrayList<>();
    private final Map<String, EffectRelationship> byChild = new HashMap<>();
    private final Map<String, List<EffectRelationship>> byParent = new HashMap<>();

    public static RelationshipLedger of(Collection<EffectRelationship> relationships) {
        RelationshipLedger ledger = new RelationshipLedger();
        ledger.appendAll(relationships);
        return ledger;
    }

    public void append(EffectRelationship relationship) {
        if (byChild.containsKey(relationship.childId())) {
            throw new IllegalStateException("Effect " + relationship.childId() + " already has a parent");
        }
        edges.add(relationship);
        byChild.put(relationship.childId(), relationship);
        byParent.computeIfAbsent(relationship.parentId(), k -> new ArrayList<>()).add(relationship);
    }

    public void appendAll(Collection<EffectRelationship> relationships) {
        for (EffectRelationship relationship : relationships) {
            append(relationship);
        }
    }

    public Optional<EffectRelationship> parentOf(String childId) {
        return Optional.ofNullable(byChild.get(childId));
    }

    public List<EffectRelationship> childrenOf(String parentId) {
        return Collections.unmodifiableList(byParent.getOrDefault(parentId, List.of()));
    }

    /**
     * All edges in insertion order.
     */
    public List<EffectRelationship> edges() {
        return Collections.unmodifiableList(edges);
    }

    public int size() {
        return edges.size();
    }
}
