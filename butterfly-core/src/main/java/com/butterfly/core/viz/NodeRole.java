package com.butterfly.core.viz;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * What a visualization node stands for.
 */
public enum NodeRole {
    ACTION("action"),
    CONSEQUENCE("consequence"),
    CASCADING_EFFECT("cascading_effect");

    private final String value;

    NodeRole(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static NodeRole fromValue(String value) {
        if (value == null) return CASCADING_EFFECT;
        for (NodeRole role : values()) {
            if (role.value.equalsIgnoreCase(value)) {
                return role;
            }
        }
        return CASCADING_EFFECT;
    }
}
