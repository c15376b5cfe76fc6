package org.pixelforge.metrics;

import org.pixelforge.config.TransformSpec;

/**
 * One measured (variant, iteration, strategy) outcome of a benchmark session.
 * {@code resources} is the delta sampled around the whole pipeline invocation.
 */
public record BenchmarkRecord(int variantIndex, TransformSpec variant, int iteration, Strategy strategy,
                              BatchSummary summary, ResourceDelta resources) {
}
