package com.butterfly.core.world;

import com.butterfly.core.model.ConsequenceType;
import com.butterfly.core.model.ImpactProfile;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only registry of world systems and the category to system table.
 *
 * <p>Built once (usually through {@link WorldCatalogLoader}) and shared by every
 * cascade invocation. All references are validated on construction, so lookups
 * never have to deal with dangling ids.</p>
 */
public final class WorldSystemCatalog {

    private final Map<String, WorldSystem> systems;
    private final Map<ConsequenceType, List<String>> categorySystems;

    public WorldSystemCatalog(Collection<WorldSystem> systems, Map<ConsequenceType, List<String>> categorySystems) {
        Map<String, WorldSystem> byId = new LinkedHashMap<>();
        for (WorldSystem system : systems) {
            if (system.id() == null || system.id().isBlank()) {
                throw new CatalogConfigurationException("World system without id: " + system);
            }
            if (byId.put(system.id(), system) != null) {
                throw new CatalogConfigurationException("Duplicate world system id: " + system.id());
            }
        }

        Map<ConsequenceType, List<String>> categories = new EnumMap<>(ConsequenceType.class);
        if (categorySystems != null) {
            categorySystems.forEach((type, ids) -> categories.put(type, List.copyOf(ids)));
        }

        validate(byId, categories);
        this.systems = Collections.unmodifiableMap(byId);
        this.categorySystems = Collections.unmodifiableMap(categories);
    }

    private static void validate(Map<String, WorldSystem> byId, Map<ConsequenceType, List<String>> categories) {
        for (WorldSystem system : byId.values()) {
            for (String connected : system.connectedSystems()) {
                if (!byId.containsKey(connected)) {
                    throw new CatalogConfigurationException(system.id(), connected);
                }
            }
            for (Map.Entry<String, Double> factor : system.influenceFactors().entrySet()) {
                if (!byId.containsKey(factor.getKey())) {
                    throw new CatalogConfigurationException(system.id(), factor.getKey());
                }
                double value = factor.getValue() != null ? factor.getValue() : Double.NaN;
                if (!(value >= 0.0 && value <= 1.0)) {
                    throw new CatalogConfigurationException(String.format(
                        "Influence factor %s -> %s must be within 0..1, was %s",
                        system.id(), factor.getKey(), factor.getValue()));
                }
            }
        }
        categories.forEach((type, ids) -> {
            for (String id : ids) {
                if (!byId.containsKey(id)) {
                    throw new CatalogConfigurationException(type.getValue(), id);
                }
            }
        });
    }

    public Collection<WorldSystem> systems() {
        return systems.values();
    }

    public Optional<WorldSystem> get(String id) {
        return Optional.ofNullable(id != null ? systems.get(id) : null);
    }

    public boolean contains(String id) {
        return id != null && systems.containsKey(id);
    }

    public int size() {
        return systems.size();
    }

    /**
     * System ids statically associated with a category.
     */
    public List<String> relatedSystems(ConsequenceType type) {
        return categorySystems.getOrDefault(type, List.of());
    }

    /**
     * Systems an effect spreads into: the known systems it names explicitly,
     * followed by those associated with its category, without duplicates.
     */
    public List<WorldSystem> systemsInfluencedBy(ConsequenceType type, ImpactProfile impact) {
        Set<String> ids = new LinkedHashSet<>();
        if (impact != null) {
            ids.addAll(impact.affectedSystems());
        }
        ids.addAll(relatedSystems(type));

        List<WorldSystem> result = new ArrayList<>(ids.size());
        for (String id : ids) {
            WorldSystem system = systems.get(id);
            if (system != null) {
                result.add(system);
            }
        }
        return result;
    }

    /**
     * Systems one hop away from the given ones, in declaration order.
     * Each source system is expanded once.
     */
    public List<WorldSystem> connectedSystems(Collection<String> systemIds) {
        List<WorldSystem> connected = new ArrayList<>();
        Set<String> processed = new LinkedHashSet<>();
        for (String id : systemIds) {
            WorldSystem system = systems.get(id);
            if (system != null && processed.add(id)) {
                for (String next : system.connectedSystems()) {
                    connected.add(systems.get(next));
                }
            }
        }
        return connected;
    }
}
