package org.pixelforge.metrics;

import org.pixelforge.config.TransformSpec;

/**
 * Means over all iterations of one (variant, strategy) pair.
 */
public record BenchmarkAggregate(int variantIndex, TransformSpec variant, Strategy strategy, int iterations,
                                 double meanWallSeconds, double meanCpuSeconds, double meanMemoryMegabytes,
                                 double meanSuccessCount, double meanFailureCount) {
}
