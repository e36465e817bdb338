package com.butterfly.core.viz;

/**
 * Propagation of a node's influence from its first region to another one.
 */
public record CrossRegionRecord(String nodeId, String sourceRegion, String targetRegion, double travelTime) {
}
