package com.butterfly.engine.viz;

import java.util.Map;

/**
 * Fixed map coordinates of the named regions, used to time cross-region propagation.
 * Unknown regions sit at the origin.
 */
public class RegionMap {

    /** Travel time per unit of map distance. */
    public static final double MS_PER_DISTANCE_UNIT = 1000;

    public record Coordinate(double x, double y) {
        public static final Coordinate ORIGIN = new Coordinate(0, 0);

        public double distanceTo(Coordinate other) {
            return Math.hypot(other.x - x, other.y - y);
        }
    }

    private static final Map<String, Coordinate> DEFAULT_REGIONS = Map.of(
        "village", new Coordinate(0, 0),
        "forest", new Coordinate(5, 3),
        "mountain", new Coordinate(-3, 7),
        "river", new Coordinate(4, -2),
        "castle", new Coordinate(-2, 1),
        "market", new Coordinate(2, -1),
        "town", new Coordinate(3, 2)
    );

    private final Map<String, Coordinate> regions;

    public RegionMap() {
        this(DEFAULT_REGIONS);
    }

    public RegionMap(Map<String, Coordinate> regions) {
        this.regions = Map.copyOf(regions);
    }

    public Coordinate locate(String region) {
        return region != null ? regions.getOrDefault(region.toLowerCase(), Coordinate.ORIGIN) : Coordinate.ORIGIN;
    }

    public double distance(String from, String to) {
        return locate(from).distanceTo(locate(to));
    }

    public double travelTime(String from, String to) {
        return distance(from, to) * MS_PER_DISTANCE_UNIT;
    }
}
