package com.butterfly.engine;

import com.butterfly.core.model.ConsequenceType;
import com.butterfly.core.model.DurationClass;
import com.butterfly.core.model.ImpactProfile;
import com.butterfly.core.model.RootConsequence;
import com.butterfly.core.model.SeverityLevel;
import com.butterfly.core.world.WorldCatalogLoader;
import com.butterfly.core.world.WorldSystemCatalog;

import java.util.List;

/**
 * Shared catalog and root consequences for engine tests.
 */
public final class CascadeFixtures {

    private static WorldSystemCatalog catalog;

    private CascadeFixtures() {
    }

    public static synchronized WorldSystemCatalog catalog() {
        if (catalog == null) {
            catalog = new WorldCatalogLoader().loadDefault();
        }
        return catalog;
    }

    public static RootConsequence root(String id, ConsequenceType type, int magnitude, double confidence) {
        return root(id, type, magnitude, confidence, List.of());
    }

    public static RootConsequence root(String id, ConsequenceType type, int magnitude, double confidence,
                                       List<String> regions) {
        return new RootConsequence(id, type, "Consequence " + id,
            new ImpactProfile(SeverityLevel.MAJOR, magnitude, DurationClass.LONG_TERM, List.of(), regions),
            confidence);
    }

    /** Major combat consequence, magnitude 8. */
    public static RootConsequence combat() {
        return root("c1", ConsequenceType.COMBAT, 8, 0.9);
    }
}
