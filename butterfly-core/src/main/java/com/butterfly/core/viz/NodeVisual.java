package com.butterfly.core.viz;

/**
 * Rendering hint for a node.
 */
public record NodeVisual(String color, double size, double opacity, double pulseSpeed) {
}
