package com.butterfly.core.config;

import com.butterfly.core.model.CascadeOptions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for engine configuration loading.
 */
class EngineConfigTest {

    @Test
    @DisplayName("Bundled defaults match the built-in cascade options")
    void bundledDefaults() {
        EngineConfig config = EngineConfig.loadDefault();

        assertEquals(CascadeOptions.defaults(), config.cascadeOptions());
        assertFalse(config.hasCustomCatalog());
        assertTrue(config.getHistoryDirectory().endsWith(".butterfly/history"));
    }

    @Test
    @DisplayName("A partial file overrides only the keys it names")
    void partialOverride(@TempDir Path dir) throws Exception {
        Path file = Files.writeString(dir.resolve("engine.yaml"), """
            cascade:
              maxCascadingLevels: 5
              includeIndirectEffects: false
            catalogFile: /srv/world.yaml
            """);

        EngineConfig config = EngineConfig.load(file);
        CascadeOptions options = config.cascadeOptions();

        assertEquals(5, options.maxCascadingLevels());
        assertFalse(options.includeIndirectEffects());
        assertEquals(4, options.maxEffectsPerLevel());
        assertEquals(0.3, options.probabilityThreshold());
        assertTrue(config.hasCustomCatalog());
        assertEquals("/srv/world.yaml", config.getCatalogFile());
    }

    @Test
    @DisplayName("A missing file leaves the defaults in place")
    void missingFile(@TempDir Path dir) throws Exception {
        EngineConfig config = EngineConfig.load(dir.resolve("absent.yaml"));

        assertEquals(CascadeOptions.defaults(), config.cascadeOptions());
    }

    @Test
    @DisplayName("Settings copies are independent")
    void settingsCopy() {
        EngineConfig.CascadeSettings settings = new EngineConfig.CascadeSettings();
        EngineConfig.CascadeSettings copy = settings.copy();
        copy.setMaxEffectsPerLevel(9);

        assertEquals(4, settings.getMaxEffectsPerLevel());
        assertEquals(9, copy.toOptions().maxEffectsPerLevel());
    }
}
