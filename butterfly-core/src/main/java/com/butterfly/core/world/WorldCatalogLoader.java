package com.butterfly.core.world;

import com.butterfly.core.model.ConsequenceType;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Loads a {@link WorldSystemCatalog} from YAML.
 * The built-in world is bundled at /world/world-systems.yaml.
 *
 * <pre>
 * systems:
 *   - id: social
 *     name: Social System
 *     connectedSystems: [relationship, character]
 *     influenceFactors: { relationship: 0.8, character: 0.9 }
 * categories:
 *   social: [character, relationship]
 * </pre>
 */
public class WorldCatalogLoader {

    private static final Logger log = LoggerFactory.getLogger(WorldCatalogLoader.class);
    public static final String DEFAULT_RESOURCE = "/world/world-systems.yaml";

    private final YAMLMapper yamlMapper = new YAMLMapper();

    @JsonIgnoreProperties(ignoreUnknown = true)
    record CatalogDocument(List<WorldSystem> systems, Map<String, List<String>> categories) {}

    /**
     * Load the bundled catalog.
     */
    public WorldSystemCatalog loadDefault() {
        try (InputStream is = WorldCatalogLoader.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (is == null) {
                throw new CatalogConfigurationException("World catalog not found at " + DEFAULT_RESOURCE);
            }
            return load(is);
        } catch (IOException e) {
            throw new CatalogConfigurationException("Failed to read world catalog " + DEFAULT_RESOURCE, e);
        }
    }

    public WorldSystemCatalog load(Path path) {
        try (InputStream is = Files.newInputStream(path)) {
            return load(is);
        } catch (IOException e) {
            throw new CatalogConfigurationException("Failed to read world catalog " + path, e);
        }
    }

    public WorldSystemCatalog load(InputStream is) {
        CatalogDocument document;
        try {
            document = yamlMapper.readValue(is, CatalogDocument.class);
        } catch (IOException e) {
            throw new CatalogConfigurationException("Malformed world catalog: " + e.getMessage(), e);
        }
        if (document == null || document.systems() == null) {
            throw new CatalogConfigurationException("World catalog declares no systems");
        }

        Map<ConsequenceType, List<String>> categories = new EnumMap<>(ConsequenceType.class);
        if (document.categories() != null) {
            document.categories().forEach((key, ids) -> {
                ConsequenceType type = ConsequenceType.fromValue(key);
                if (!type.getValue().equalsIgnoreCase(key)) {
                    throw new CatalogConfigurationException("Unknown effect category in world catalog: " + key);
                }
                categories.put(type, ids != null ? ids : List.of());
            });
        }

        WorldSystemCatalog catalog = new WorldSystemCatalog(document.systems(), categories);
        log.info("Loaded world catalog with {} systems and {} categories", catalog.size(), categories.size());
        return catalog;
    }
}
