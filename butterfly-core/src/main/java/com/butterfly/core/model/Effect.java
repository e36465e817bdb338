package com.butterfly.core.model;

/**
 * Common view over root consequences and derived cascading effects,
 * used wherever the cascade treats both as frontier members.
 */
public interface Effect {

    String id();

    String description();

    ImpactProfile impact();

    /**
     * Chance (0-1) that this effect actually happens.
     */
    double probability();

    /**
     * Category used to pick the world systems this effect spreads into.
     */
    ConsequenceType category();
}
