package org.pixelforge.metrics;

/**
 * Category of a per-file failure.
 */
public enum ErrorKind {
    DECODE,
    TRANSFORM,
    ENCODE,
    UNEXPECTED // runtime exception caught at the worker boundary
}
