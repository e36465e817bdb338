package com.butterfly.core.viz;

import java.util.List;

/**
 * Snapshot of what is visible at a point in the animation.
 */
public record Keyframe(long time, List<String> activeNodeIds, List<String> activeConnectionIds) {

    public Keyframe {
        activeNodeIds = activeNodeIds != null ? List.copyOf(activeNodeIds) : List.of();
        activeConnectionIds = activeConnectionIds != null ? List.copyOf(activeConnectionIds) : List.of();
    }
}
