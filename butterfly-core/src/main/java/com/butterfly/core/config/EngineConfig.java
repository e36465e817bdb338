package com.butterfly.core.config;

import com.butterfly.core.model.CascadeOptions;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonMerge;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Engine configuration read from YAML.
 *
 * Defaults ship as /butterfly.yaml on the classpath; a file passed to
 * {@link #load(Path)} is read on top of them, so it only needs the keys it changes.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class EngineConfig {

    private static final Logger log = LoggerFactory.getLogger(EngineConfig.class);
    private static final String DEFAULT_RESOURCE = "/butterfly.yaml";
    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    @JsonMerge
    private CascadeSettings cascade = new CascadeSettings();
    private String catalogFile = null;
    private String historyDirectory = System.getProperty("user.home") + "/.butterfly/history";

    public EngineConfig() {
    }

    public CascadeSettings getCascade() {
        return cascade;
    }

    public void setCascade(CascadeSettings cascade) {
        this.cascade = cascade != null ? cascade : new CascadeSettings();
    }

    /**
     * Default options for invocations that do not bring their own.
     */
    @JsonIgnore
    public CascadeOptions cascadeOptions() {
        return cascade.toOptions();
    }

    /**
     * Optional path of a world catalog replacing the bundled one.
     */
    public String getCatalogFile() {
        return catalogFile;
    }

    public void setCatalogFile(String catalogFile) {
        this.catalogFile = catalogFile;
    }

    public String getHistoryDirectory() {
        return historyDirectory;
    }

    public void setHistoryDirectory(String historyDirectory) {
        this.historyDirectory = historyDirectory;
    }

    @JsonIgnore
    public boolean hasCustomCatalog() {
        return catalogFile != null && !catalogFile.isBlank();
    }

    /**
     * Mutable mirror of {@link CascadeOptions} so partial YAML overrides keep the other defaults.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CascadeSettings {
        private int maxCascadingLevels = CascadeOptions.DEFAULT_MAX_LEVELS;
        private int maxEffectsPerLevel = CascadeOptions.DEFAULT_MAX_EFFECTS_PER_LEVEL;
        private double probabilityThreshold = CascadeOptions.DEFAULT_PROBABILITY_THRESHOLD;
        private boolean includeIndirectEffects = true;
        private double minInfluenceFactor = CascadeOptions.DEFAULT_MIN_INFLUENCE_FACTOR;

        public int getMaxCascadingLevels() { return maxCascadingLevels; }
        public void setMaxCascadingLevels(int maxCascadingLevels) { this.maxCascadingLevels = maxCascadingLevels; }

        public int getMaxEffectsPerLevel() { return maxEffectsPerLevel; }
        public void setMaxEffectsPerLevel(int maxEffectsPerLevel) { this.maxEffectsPerLevel = maxEffectsPerLevel; }

        public double getProbabilityThreshold() { return probabilityThreshold; }
        public void setProbabilityThreshold(double probabilityThreshold) { this.probabilityThreshold = probabilityThreshold; }

        public boolean isIncludeIndirectEffects() { return includeIndirectEffects; }
        public void setIncludeIndirectEffects(boolean includeIndirectEffects) { this.includeIndirectEffects = includeIndirectEffects; }

        public double getMinInfluenceFactor() { return minInfluenceFactor; }
        public void setMinInfluenceFactor(double minInfluenceFactor) { this.minInfluenceFactor = minInfluenceFactor; }

        public CascadeSettings copy() {
            CascadeSettings copy = new CascadeSettings();
            copy.maxCascadingLevels = maxCascadingLevels;
            copy.maxEffectsPerLevel = maxEffectsPerLevel;
            copy.probabilityThreshold = probabilityThreshold;
            copy.includeIndirectEffects = includeIndirectEffects;
            copy.minInfluenceFactor = minInfluenceFactor;
            return copy;
        }

        public CascadeOptions toOptions() {
            return new CascadeOptions(maxCascadingLevels, maxEffectsPerLevel, probabilityThreshold,
                includeIndirectEffects, minInfluenceFactor);
        }
    }

    // ==================== Loading ====================

    public static EngineConfig loadDefault() {
        try (InputStream is = EngineConfig.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (is == null) {
                log.debug("No {} on classpath, using built-in defaults", DEFAULT_RESOURCE);
                return new EngineConfig();
            }
            return YAML.readValue(is, EngineConfig.class);
        } catch (IOException e) {
            log.warn("Failed to read {}: {}", DEFAULT_RESOURCE, e.getMessage());
            return new EngineConfig();
        }
    }

    /**
     * Defaults overlaid with the given file.
     */
    public static EngineConfig load(Path path) throws IOException {
        EngineConfig config = loadDefault();
        if (path == null || !Files.exists(path)) {
            return config;
        }
        try (InputStream is = Files.newInputStream(path)) {
            return YAML.readerForUpdating(config).readValue(is);
        }
    }
}
