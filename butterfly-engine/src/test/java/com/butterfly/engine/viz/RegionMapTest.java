package com.butterfly.engine.viz;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for region coordinates and the opportunity rules.
 */
class RegionMapTest {

    private static final double EPS = 1e-9;

    private final RegionMap regions = new RegionMap();

    @Test
    @DisplayName("Travel time is 1000 ms per unit of distance")
    void travelTime() {
        assertEquals(Math.hypot(5, 3) * 1000, regions.travelTime("village", "forest"), EPS);
        assertEquals(Math.hypot(4, 2) * 1000, regions.travelTime("castle", "market"), EPS);
        assertEquals(0, regions.travelTime("town", "town"), EPS);
    }

    @Test
    @DisplayName("Names are case-insensitive and unknown regions sit at the origin")
    void lookup() {
        assertEquals(new RegionMap.Coordinate(5, 3), regions.locate("Forest"));
        assertEquals(RegionMap.Coordinate.ORIGIN, regions.locate("atlantis"));
        assertEquals(RegionMap.Coordinate.ORIGIN, regions.locate(null));
        assertEquals(Math.hypot(4, -2), regions.distance("atlantis", "river"), EPS);
    }

    @Test
    @DisplayName("A custom map replaces the defaults")
    void customMap() {
        RegionMap custom = new RegionMap(Map.of("harbor", new RegionMap.Coordinate(3, 4)));

        assertEquals(5000, custom.travelTime("harbor", "village"), EPS);
    }

    @Test
    @DisplayName("Opportunity rules match complementary categories in either order")
    void opportunityRules() {
        OpportunityRule market = OpportunityRule.DEFAULTS.get(0);
        OpportunityRule discovery = OpportunityRule.DEFAULTS.get(1);

        assertTrue(market.matches(List.of("economic"), List.of("social", "character")));
        assertTrue(market.matches(List.of("social"), List.of("economic")));
        assertFalse(market.matches(List.of("economic", "social"), List.of()));
        assertFalse(market.matches(List.of("economic"), List.of("economic")));

        assertEquals("Hidden Discovery", discovery.title());
        assertTrue(discovery.matches(List.of("exploration"), List.of("environment")));
    }
}
