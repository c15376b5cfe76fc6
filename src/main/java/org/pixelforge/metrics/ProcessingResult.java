package org.pixelforge.metrics;

import java.time.Duration;

/**
 * Outcome of one input file. {@code errorKind} and {@code errorMessage} are null on success.
 */
public record ProcessingResult(String fileName, Status status, ErrorKind errorKind, String errorMessage,
                               Duration elapsed, long memoryDeltaBytes, String threadName) implements HasStatus {

    public boolean succeeded() {
        return status == Status.SUCCESS;
    }
}
