package org.pixelforge.metrics;

/**
 * Point-in-time process counters: monotonic wall clock, process CPU time and resident memory.
 */
public record ResourceSnapshot(long wallNanos, long cpuNanos, long residentMemoryBytes) {

    public ResourceDelta deltaTo(final ResourceSnapshot after) {
        return new ResourceDelta(after.wallNanos - wallNanos, after.cpuNanos - cpuNanos,
                after.residentMemoryBytes - residentMemoryBytes);
    }
}
