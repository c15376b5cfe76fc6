package org.pixelforge.metrics;

import java.time.Duration;

/**
 * Difference between two {@link ResourceSnapshot}s. The memory delta may be negative
 * when a collection ran during the measured unit.
 */
public record ResourceDelta(long wallNanos, long cpuNanos, long memoryBytes) {

    public Duration wallTime() {
        return Duration.ofNanos(wallNanos);
    }

    public Duration cpuTime() {
        return Duration.ofNanos(cpuNanos);
    }

    public double wallSeconds() {
        return wallNanos / 1_000_000_000.0;
    }

    public double cpuSeconds() {
        return cpuNanos / 1_000_000_000.0;
    }

    public double memoryMegabytes() {
        return memoryBytes / (1024.0 * 1024.0);
    }
}
