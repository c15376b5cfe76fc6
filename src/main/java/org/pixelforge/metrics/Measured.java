package org.pixelforge.metrics;

/**
 * Result of a unit of work together with the resources it consumed.
 */
public record Measured<T>(T result, ResourceDelta delta) {
}
