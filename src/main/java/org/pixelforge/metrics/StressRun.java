package org.pixelforge.metrics;

import org.pixelforge.config.TransformSpec;

/**
 * One profiled pass of a stress test: the parameters used, the iteration and its report.
 */
public record StressRun(TransformSpec parameters, int iteration, ProfileReport report) {
}
