package org.pixelforge.processing;

/**
 * The whole invocation cannot run: input directory missing, unreadable or empty,
 * or the output directory cannot be created. Raised before any file is processed.
 */
public class BatchFatalException extends Exception {

    public BatchFatalException(final String message) {
        super(message);
    }

    public BatchFatalException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
