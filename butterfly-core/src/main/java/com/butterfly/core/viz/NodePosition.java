package com.butterfly.core.viz;

/**
 * Initial layout position. Layer 0 is the action, 1 the root consequences,
 * level + 1 for cascading effects.
 */
public record NodePosition(double x, double y, int layer) {

    public static final NodePosition ORIGIN = new NodePosition(0, 0, 0);

    /**
     * Point on a circle of the given radius around this position.
     */
    public NodePosition around(double radius, double angle, int layer) {
        return new NodePosition(x + radius * Math.cos(angle), y + radius * Math.sin(angle), layer);
    }
}
