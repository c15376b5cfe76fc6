package org.pixelforge.metrics;

/**
 * Execution strategy of a pipeline run.
 */
public enum Strategy {
    SEQUENTIAL,
    PARALLEL
}
