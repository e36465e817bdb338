package com.butterfly.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How long an effect lasts, ordered from temporary to permanent.
 */
public enum DurationClass {
    TEMPORARY("temporary"),
    SHORT_TERM("short_term"),
    MEDIUM_TERM("medium_term"),
    LONG_TERM("long_term"),
    PERMANENT("permanent");

    private final String value;

    DurationClass(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static DurationClass fromValue(String value) {
        if (value == null) return SHORT_TERM;
        for (DurationClass duration : values()) {
            if (duration.value.equalsIgnoreCase(value)) {
                return duration;
            }
        }
        // Accept the short spellings too ("short", "long", ...)
        for (DurationClass duration : values()) {
            if (duration.value.startsWith(value.toLowerCase() + "_")) {
                return duration;
            }
        }
        return SHORT_TERM;
    }

    /**
     * One step shorter, floored at {@link #TEMPORARY}.
     */
    public DurationClass shorter() {
        return this == TEMPORARY ? TEMPORARY : values()[ordinal() - 1];
    }
}
