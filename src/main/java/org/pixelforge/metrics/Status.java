package org.pixelforge.metrics;

/**
 * Represents the outcome of processing one image file.
 */
public enum Status {
    SUCCESS, // Written to the output directory
    FAILED   // Decode, transform or encode failed
}
