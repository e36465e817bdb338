package com.butterfly.engine.viz;

import com.butterfly.core.model.CascadeNetwork;
import com.butterfly.core.model.CascadingEffect;
import com.butterfly.core.model.DurationClass;
import com.butterfly.core.model.EffectRelationship;
import com.butterfly.core.model.RelationshipKind;
import com.butterfly.core.model.RootConsequence;
import com.butterfly.core.model.SeverityLevel;
import com.butterfly.core.viz.CascadeVisualization;
import com.butterfly.core.viz.ConnectionVisual;
import com.butterfly.core.viz.CrossRegionRecord;
import com.butterfly.core.viz.EmergentOpportunity;
import com.butterfly.core.viz.Keyframe;
import com.butterfly.core.viz.NodeMetadata;
import com.butterfly.core.viz.NodePosition;
import com.butterfly.core.viz.NodeRole;
import com.butterfly.core.viz.NodeVisual;
import com.butterfly.core.viz.TemporalProgression;
import com.butterfly.core.viz.TemporalWindow;
import com.butterfly.core.viz.VisualizationConnection;
import com.butterfly.core.viz.VisualizationNode;
import com.butterfly.engine.CascadeRandom;
import com.butterfly.engine.RelationshipLedger;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns an expanded {@link CascadeNetwork} into the renderable {@link CascadeVisualization}.
 *
 * Layout is a starting point for the client's force layout: the action at the
 * origin, root consequences on a ring around it, each cascading effect on a
 * smaller ring around its parent. Metadata is left for the caller to fill in.
 */
public class VisualizationSynthesizer {

    public static final double CONSEQUENCE_RADIUS = 150;
    public static final double EFFECT_RADIUS = 100;
    public static final long ANIMATION_WINDOW_MS = 2000;
    public static final long KEYFRAME_STEP_MS = 2000;
    public static final long MIN_TOTAL_DURATION_MS = 15000;

    private static final String ACTION_COLOR = "#4CAF50";
    private static final String ANIMATION_TYPE = "curved";

    private final RegionMap regionMap;
    private final List<OpportunityRule> opportunityRules;

    public VisualizationSynthesizer() {
        this(new RegionMap(), OpportunityRule.DEFAULTS);
    }

    public VisualizationSynthesizer(RegionMap regionMap, List<OpportunityRule> opportunityRules) {
        this.regionMap = regionMap;
        this.opportunityRules = List.copyOf(opportunityRules);
    }

    public CascadeVisualization synthesize(String actionId, String actionDescription, CascadeNetwork network,
                                           RelationshipLedger ledger, CascadeRandom random) {
        Map<String, CascadingEffect> effectsById = new HashMap<>();
        for (CascadingEffect effect : network.cascadingEffects()) {
            effectsById.put(effect.id(), effect);
        }

        List<VisualizationNode> nodes = createNodes(actionId, actionDescription, network, ledger);
        List<VisualizationConnection> connections = createConnections(actionId, network, ledger, effectsById, random);

        return new CascadeVisualization(
            nodes.get(0),
            nodes,
            connections,
            temporalProgression(nodes, connections),
            crossRegionEffects(nodes),
            emergentOpportunities(nodes, random),
            null
        );
    }

    // ==================== Nodes ====================

    private List<VisualizationNode> createNodes(String actionId, String actionDescription,
                                                CascadeNetwork network, RelationshipLedger ledger) {
        List<VisualizationNode> nodes = new ArrayList<>();
        Map<String, NodePosition> positions = new HashMap<>();

        VisualizationNode actionNode = actionNode(actionId, actionDescription);
        nodes.add(actionNode);
        positions.put(actionId, actionNode.position());

        List<RootConsequence> roots = network.rootConsequences();
        for (int i = 0; i < roots.size(); i++) {
            double angle = 2 * Math.PI * i / roots.size();
            NodePosition position = NodePosition.ORIGIN.around(CONSEQUENCE_RADIUS, angle, 1);
            VisualizationNode node = consequenceNode(roots.get(i), position);
            nodes.add(node);
            positions.put(node.id(), position);
        }

        for (CascadingEffect effect : network.cascadingEffects()) {
            String parentId = ledger.parentOf(effect.id())
                .map(EffectRelationship::parentId)
                .orElse(effect.parentEffectId());
            NodePosition parentPosition = positions.get(parentId);
            if (parentPosition == null) {
                throw new IllegalStateException("Effect " + effect.id() + " refers to unplaced parent " + parentId);
            }

            List<EffectRelationship> siblings = ledger.childrenOf(parentId);
            int index = indexOfChild(siblings, effect.id());
            double angle = 2 * Math.PI * index / Math.max(1, siblings.size());
            NodePosition position = parentPosition.around(EFFECT_RADIUS, angle, effect.level() + 1);

            VisualizationNode node = cascadingNode(effect, position);
            nodes.add(node);
            positions.put(node.id(), position);
        }
        return nodes;
    }

    private static int indexOfChild(List<EffectRelationship> siblings, String childId) {
        for (int i = 0; i < siblings.size(); i++) {
            if (siblings.get(i).childId().equals(childId)) return i;
        }
        return 0;
    }

    private VisualizationNode actionNode(String actionId, String description) {
        NodeMetadata metadata = new NodeMetadata(
            "Player Action", description, SeverityLevel.MINOR, 1.0,
            List.of(), List.of(), DurationClass.TEMPORARY, 1);
        return new VisualizationNode(actionId, NodeRole.ACTION, NodePosition.ORIGIN, metadata,
            new NodeVisual(ACTION_COLOR, 20, 1.0, 2.0));
    }

    private VisualizationNode consequenceNode(RootConsequence consequence, NodePosition position) {
        Set<String> systems = new LinkedHashSet<>();
        systems.add(consequence.type().getValue());
        systems.addAll(consequence.impact().affectedSystems());

        int magnitude = consequence.impact().magnitude();
        NodeMetadata metadata = new NodeMetadata(
            consequence.type().title(),
            consequence.description(),
            consequence.impact().severity(),
            consequence.confidence(),
            List.copyOf(systems),
            consequence.impact().affectedRegions(),
            consequence.impact().duration(),
            magnitude);
        NodeVisual visual = new NodeVisual(
            consequence.type().color(),
            Math.max(10, magnitude * 3),
            Math.max(0.3, consequence.confidence()),
            magnitude > 7 ? 3.0 : 1.5);
        return new VisualizationNode(consequence.id(), NodeRole.CONSEQUENCE, position, metadata, visual);
    }

    private VisualizationNode cascadingNode(CascadingEffect effect, NodePosition position) {
        int magnitude = effect.impact().magnitude();
        NodeMetadata metadata = new NodeMetadata(
            effectTitle(effect),
            effect.description(),
            effect.impact().severity(),
            effect.probability(),
            effect.impact().affectedSystems(),
            effect.impact().affectedRegions(),
            effect.impact().duration(),
            magnitude);
        NodeVisual visual = new NodeVisual(
            effect.category().color(),
            Math.max(8, magnitude * 2),
            Math.max(0.2, effect.probability()),
            1.0);
        return new VisualizationNode(effect.id(), NodeRole.CASCADING_EFFECT, position, metadata, visual);
    }

    private static String effectTitle(CascadingEffect effect) {
        if (effect.origin() == RelationshipKind.INDIRECT) {
            return "Indirect Effect";
        }
        return switch (effect.level()) {
            case 1 -> "Secondary Effect";
            case 2 -> "Tertiary Effect";
            default -> "Ripple Effect";
        };
    }

    // ==================== Connections ====================

    private List<VisualizationConnection> createConnections(String actionId, CascadeNetwork network,
                                                            RelationshipLedger ledger,
                                                            Map<String, CascadingEffect> effectsById,
                                                            CascadeRandom random) {
        List<VisualizationConnection> connections = new ArrayList<>();

        for (RootConsequence root : network.rootConsequences()) {
            connections.add(connection(random.nextId(), actionId, root.id(), RelationshipKind.DIRECT,
                root.confidence(), 0, root.confidence()));
        }

        for (EffectRelationship edge : ledger.edges()) {
            CascadingEffect child = effectsById.get(edge.childId());
            double probability = child != null ? child.probability() : edge.strength();
            connections.add(connection(random.nextId(), edge.parentId(), edge.childId(), edge.kind(),
                edge.strength(), edge.delay(), probability));
        }
        return connections;
    }

    private static VisualizationConnection connection(String id, String source, String target, RelationshipKind kind,
                                                      double strength, long delay, double probability) {
        ConnectionVisual visual = new ConnectionVisual(
            kind.color(),
            Math.max(1, (int) Math.floor(strength * 5)),
            kind.dashPattern(),
            ANIMATION_TYPE);
        TemporalWindow window = new TemporalWindow(delay, delay + ANIMATION_WINDOW_MS, ANIMATION_WINDOW_MS);
        return new VisualizationConnection(id, source, target, kind, strength, delay, probability, visual, window);
    }

    // ==================== Timeline ====================

    private static TemporalProgression temporalProgression(List<VisualizationNode> nodes,
                                                           List<VisualizationConnection> connections) {
        long totalDuration = MIN_TOTAL_DURATION_MS;
        for (VisualizationConnection connection : connections) {
            totalDuration = Math.max(totalDuration, connection.window().endTime());
        }

        // Nodes show from the start; only connections are scheduled
        List<String> nodeIds = nodes.stream().map(VisualizationNode::id).toList();
        List<Keyframe> keyframes = new ArrayList<>();
        for (long time = 0; time <= totalDuration; time += KEYFRAME_STEP_MS) {
            final long t = time;
            List<String> active = connections.stream()
                .filter(c -> c.window().contains(t))
                .map(VisualizationConnection::id)
                .toList();
            keyframes.add(new Keyframe(time, nodeIds, active));
        }
        return new TemporalProgression(totalDuration, keyframes);
    }

    // ==================== Regions ====================

    private List<CrossRegionRecord> crossRegionEffects(List<VisualizationNode> nodes) {
        List<CrossRegionRecord> records = new ArrayList<>();
        for (VisualizationNode node : nodes) {
            List<String> regions = node.metadata().affectedRegions();
            if (regions.size() < 2) continue;

            String source = regions.get(0);
            for (int i = 1; i < regions.size(); i++) {
                String target = regions.get(i);
                records.add(new CrossRegionRecord(node.id(), source, target, regionMap.travelTime(source, target)));
            }
        }
        return records;
    }

    // ==================== Opportunities ====================

    /**
     * Checks every unordered node pair. Quadratic, but node counts are bounded by the fan-out caps.
     */
    private List<EmergentOpportunity> emergentOpportunities(List<VisualizationNode> nodes, CascadeRandom random) {
        List<EmergentOpportunity> opportunities = new ArrayList<>();
        for (int i = 0; i < nodes.size(); i++) {
            for (int j = i + 1; j < nodes.size(); j++) {
                VisualizationNode first = nodes.get(i);
                VisualizationNode second = nodes.get(j);
                for (OpportunityRule rule : opportunityRules) {
                    if (rule.matches(first.metadata().affectedSystems(), second.metadata().affectedSystems())) {
                        opportunities.add(new EmergentOpportunity(
                            random.nextId(),
                            rule.title(),
                            rule.description(),
                            rule.requiredConditions(),
                            rule.potentialOutcomes(),
                            List.of(first.id(), second.id())));
                        break;
                    }
                }
            }
        }
        return opportunities;
    }
}
