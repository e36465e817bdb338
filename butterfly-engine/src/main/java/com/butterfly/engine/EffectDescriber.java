package com.butterfly.engine;

import com.butterfly.core.model.ConsequenceType;
import com.butterfly.core.model.SeverityLevel;
import com.butterfly.core.world.WorldSystem;
import com.butterfly.core.world.WorldSystemCatalog;

import java.util.List;
import java.util.Map;

/**
 * Short template descriptions for synthesized effects.
 * Wording varies through the invocation's {@link CascadeRandom}.
 */
public class EffectDescriber {

    private static final Map<SeverityLevel, List<String>> ADVERBS = Map.of(
        SeverityLevel.MINOR, List.of("slightly", "a little", "marginally"),
        SeverityLevel.MODERATE, List.of("moderately", "notably", "significantly"),
        SeverityLevel.MAJOR, List.of("strongly", "heavily", "intensely"),
        SeverityLevel.SIGNIFICANT, List.of("very", "extremely", "highly"),
        SeverityLevel.CRITICAL, List.of("critically", "severely", "dramatically")
    );

    private final WorldSystemCatalog catalog;
    private final CascadeRandom random;

    public EffectDescriber(WorldSystemCatalog catalog, CascadeRandom random) {
        this.catalog = catalog;
        this.random = random;
    }

    public String describeDirect(String sourceSystemId, String targetSystemId, SeverityLevel severity, ConsequenceType parentType) {
        String target = displayName(targetSystemId);
        String source = displayName(sourceSystemId);
        String adverb = random.pick(ADVERBS.getOrDefault(severity, ADVERBS.get(SeverityLevel.MODERATE)));

        List<String> templates = List.of(
            capitalize(adverb) + " affects the " + target,
            "The " + source + " " + adverb + " influences the " + target,
            "Creates " + adverb + " changes in the " + target,
            "The " + target + " responds " + adverb + " to the " + parentType.title().toLowerCase()
        );
        return random.pick(templates);
    }

    public String describeIndirect(String systemId) {
        String name = displayName(systemId);
        List<String> templates = List.of(
            "Indirectly affects the " + name + " through system connections",
            "The " + name + " experiences secondary effects",
            "System interconnections influence the " + name,
            "Ripple effects reach the " + name
        );
        return random.pick(templates);
    }

    private String displayName(String systemId) {
        return catalog.get(systemId).map(WorldSystem::name).orElse(systemId);
    }

    private static String capitalize(String text) {
        return text.isEmpty() ? text : Character.toUpperCase(text.charAt(0)) + text.substring(1);
    }
}
