package com.butterfly.core.viz;

/**
 * Rendering hint for a connection.
 */
public record ConnectionVisual(String color, int thickness, String dashPattern, String animationType) {
}
