package com.butterfly.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Category of an effect. The id doubles as a world system id where a system
 * of the same name exists (economic, social, environment, ...).
 */
public enum ConsequenceType {
    RELATIONSHIP("relationship", "Relationship Change", "#2196F3"),
    ENVIRONMENT("environment", "Environmental Effect", "#4CAF50"),
    CHARACTER("character", "Character Impact", "#9C27B0"),
    WORLD_STATE("world_state", "World Change", "#FF9800"),
    ECONOMIC("economic", "Economic Impact", "#F44336"),
    SOCIAL("social", "Social Effect", "#00BCD4"),
    COMBAT("combat", "Combat Outcome", "#FF5722"),
    EXPLORATION("exploration", "Discovery", "#795548"),
    OTHER("other", "Unknown Effect", "#607D8B");

    private final String value;
    private final String title;
    private final String color;

    ConsequenceType(String value, String title, String color) {
        this.value = value;
        this.title = title;
        this.color = color;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String title() {
        return title;
    }

    public String color() {
        return color;
    }

    @JsonCreator
    public static ConsequenceType fromValue(String value) {
        if (value == null) return OTHER;
        for (ConsequenceType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        return OTHER;
    }

    /**
     * Category of an effect that lands on a single world system.
     * Systems without a category of their own count as world state changes.
     */
    public static ConsequenceType forSystem(String systemId) {
        if (systemId != null) {
            for (ConsequenceType type : values()) {
                if (type != OTHER && type.value.equals(systemId)) {
                    return type;
                }
            }
        }
        return WORLD_STATE;
    }
}
