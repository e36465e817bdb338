package com.butterfly.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Ordered severity scale of an effect's impact.
 * Declaration order is the scale order: minor is the weakest.
 */
public enum SeverityLevel {
    MINOR("minor"),
    MODERATE("moderate"),
    MAJOR("major"),
    SIGNIFICANT("significant"),
    CRITICAL("critical");

    private final String value;

    SeverityLevel(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static SeverityLevel fromValue(String value) {
        if (value == null) return MODERATE;
        for (SeverityLevel level : values()) {
            if (level.value.equalsIgnoreCase(value)) {
                return level;
            }
        }
        return MODERATE;
    }

    /**
     * One step down the scale, floored at {@link #MINOR}.
     */
    public SeverityLevel weaker() {
        return this == MINOR ? MINOR : values()[ordinal() - 1];
    }
}
