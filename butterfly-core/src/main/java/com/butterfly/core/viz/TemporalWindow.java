package com.butterfly.core.viz;

/**
 * Time span (ms from the action) during which a connection animates.
 */
public record TemporalWindow(long startTime, long endTime, long animationDuration) {

    public boolean contains(long time) {
        return time >= startTime && time <= endTime;
    }
}
