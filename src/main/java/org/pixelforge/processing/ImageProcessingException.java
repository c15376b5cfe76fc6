package org.pixelforge.processing;

import org.pixelforge.metrics.ErrorKind;

/**
 * Per-file failure. Caught at the worker boundary and turned into a failed result.
 */
public abstract class ImageProcessingException extends Exception {

    private final ErrorKind kind;

    protected ImageProcessingException(final ErrorKind kind, final String message, final Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
