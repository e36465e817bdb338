package com.butterfly.core.viz;

import com.butterfly.core.model.DurationClass;
import com.butterfly.core.model.RelationshipKind;
import com.butterfly.core.model.SeverityLevel;

import java.time.Instant;
import java.util.List;

/**
 * Small hand-built visualizations for tests that do not need the engine.
 */
public final class VisualizationFixtures {

    private VisualizationFixtures() {
    }

    public static VisualizationNode node(String id, NodeRole role, int magnitude, DurationClass duration,
                                         List<String> regions) {
        NodeMetadata metadata = new NodeMetadata("Title " + id, "Description " + id, SeverityLevel.MAJOR,
            0.75, List.of("economic"), regions, duration, magnitude);
        return new VisualizationNode(id, role, new NodePosition(150, -37.5, role == NodeRole.ACTION ? 0 : 1),
            metadata, new NodeVisual("#F44336", 18, 0.75, 1.5));
    }

    /**
     * Action "a1" with a major permanent consequence "c1" and a mild cascading effect "e1".
     */
    public static CascadeVisualization sample() {
        VisualizationNode action = node("a1", NodeRole.ACTION, 1, DurationClass.TEMPORARY, List.of());
        VisualizationNode consequence = node("c1", NodeRole.CONSEQUENCE, 6, DurationClass.PERMANENT,
            List.of("forest", "village"));
        VisualizationNode effect = node("e1", NodeRole.CASCADING_EFFECT, 3, DurationClass.SHORT_TERM, List.of());

        VisualizationConnection first = new VisualizationConnection("k1", "a1", "c1", RelationshipKind.DIRECT,
            0.75, 0, 0.75, new ConnectionVisual("#4CAF50", 3, "solid", "curved"), new TemporalWindow(0, 2000, 2000));
        VisualizationConnection second = new VisualizationConnection("k2", "c1", "e1", RelationshipKind.INDIRECT,
            0.21, 4321, 0.42, new ConnectionVisual("#2196F3", 1, "dashed", "curved"),
            new TemporalWindow(4321, 6321, 2000));

        List<String> nodeIds = List.of("a1", "c1", "e1");
        TemporalProgression timeline = new TemporalProgression(15000, List.of(
            new Keyframe(0, nodeIds, List.of("k1")),
            new Keyframe(2000, nodeIds, List.of("k1")),
            new Keyframe(4000, nodeIds, List.of()),
            new Keyframe(6000, nodeIds, List.of("k2"))));

        return new CascadeVisualization(
            action,
            List.of(action, consequence, effect),
            List.of(first, second),
            timeline,
            List.of(new CrossRegionRecord("c1", "forest", "village", 5830.95)),
            List.of(new EmergentOpportunity("o1", "Market Social Event", "Gathering",
                List.of("Economic stability"), List.of("Increased prosperity"), List.of("c1", "e1"))),
            new VisualizationMetadata(3, 2, 1, 1, 1, 12, Instant.parse("2026-03-01T10:15:30Z")));
    }
}
