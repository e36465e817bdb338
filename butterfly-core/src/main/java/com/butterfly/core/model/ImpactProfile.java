package com.butterfly.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * How hard an effect hits and where.
 *
 * Values coming from the text generation side are trusted structurally but
 * clamped: magnitude to 1..10, missing levels to their defaults, missing
 * lists to empty.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ImpactProfile(
    SeverityLevel severity,
    int magnitude,               // 1-10 scale
    DurationClass duration,
    List<String> affectedSystems,
    List<String> affectedRegions
) {
    public static final int MIN_MAGNITUDE = 1;
    public static final int MAX_MAGNITUDE = 10;

    public ImpactProfile {
        severity = severity != null ? severity : SeverityLevel.MODERATE;
        duration = duration != null ? duration : DurationClass.SHORT_TERM;
        magnitude = Math.max(MIN_MAGNITUDE, Math.min(MAX_MAGNITUDE, magnitude));
        affectedSystems = affectedSystems != null ? List.copyOf(affectedSystems) : List.of();
        affectedRegions = affectedRegions != null ? List.copyOf(affectedRegions) : List.of();
    }

    /**
     * Impact limited to one system with no regional footprint.
     */
    public static ImpactProfile onSystem(SeverityLevel severity, int magnitude, DurationClass duration, String systemId) {
        return new ImpactProfile(severity, magnitude, duration, List.of(systemId), List.of());
    }
}
