package com.butterfly.core.viz;

import java.util.List;

public record TemporalProgression(long totalDuration, List<Keyframe> keyframes) {

    public TemporalProgression {
        keyframes = keyframes != null ? List.copyOf(keyframes) : List.of();
    }
}
