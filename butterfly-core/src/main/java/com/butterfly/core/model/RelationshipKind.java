package com.butterfly.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of a parent to child edge in the cascade graph.
 */
public enum RelationshipKind {
    DIRECT("direct", "#4CAF50", "solid"),
    INDIRECT("indirect", "#2196F3", "dashed"),
    AMPLIFYING("amplifying", "#FF9800", "solid"),
    MITIGATING("mitigating", "#F44336", "dotted");

    private final String value;
    private final String color;
    private final String dashPattern;

    RelationshipKind(String value, String color, String dashPattern) {
        this.value = value;
        this.color = color;
        this.dashPattern = dashPattern;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String color() {
        return color;
    }

    public String dashPattern() {
        return dashPattern;
    }

    @JsonCreator
    public static RelationshipKind fromValue(String value) {
        if (value == null) return DIRECT;
        for (RelationshipKind kind : values()) {
            if (kind.value.equalsIgnoreCase(value)) {
                return kind;
            }
        }
        return DIRECT;
    }
}
