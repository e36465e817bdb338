package com.butterfly.engine.viz;

import java.util.Collection;
import java.util.List;

/**
 * Pair of complementary effect categories and the opportunity their co-occurrence opens up.
 */
public record OpportunityRule(
    String firstCategory,
    String secondCategory,
    String title,
    String description,
    List<String> requiredConditions,
    List<String> potentialOutcomes
) {
    public static final List<OpportunityRule> DEFAULTS = List.of(
        new OpportunityRule("economic", "social",
            "Market Social Event",
            "Economic and social changes create opportunity for community gathering",
            List.of("Economic stability", "Social harmony"),
            List.of("Increased prosperity", "Improved relationships")),
        new OpportunityRule("environment", "exploration",
            "Hidden Discovery",
            "Environmental changes reveal new areas to explore",
            List.of("Environmental change", "Curiosity"),
            List.of("New locations", "Rare resources"))
    );

    /**
     * True when one side touches the first category and the other side the second, in either order.
     */
    public boolean matches(Collection<String> systems, Collection<String> otherSystems) {
        return (systems.contains(firstCategory) && otherSystems.contains(secondCategory))
            || (systems.contains(secondCategory) && otherSystems.contains(firstCategory));
    }
}
