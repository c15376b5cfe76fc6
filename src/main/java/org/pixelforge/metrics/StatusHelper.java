package org.pixelforge.metrics;

import java.time.Duration;
import java.util.List;
import java.util.logging.Logger;

/**
 * Helper methods for creating result instances, especially for failure cases,
 * and determining overall status.
 */
public final class StatusHelper {

    private static final Logger LOGGER = Logger.getLogger(StatusHelper.class.getName());

    private StatusHelper() {
    } // Prevent instantiation

    // --- Result Creators ---

    public static ProcessingResult createSuccessResult(final String fileName, final Duration elapsed, final long memoryDeltaBytes) {
        return new ProcessingResult(fileName, Status.SUCCESS, null, null, elapsed, memoryDeltaBytes,
                Thread.currentThread().getName());
    }

    public static ProcessingResult createFailedResult(final String fileName, final ErrorKind kind, final Throwable cause,
                                                      final Duration elapsed, final long memoryDeltaBytes) {
        return new ProcessingResult(fileName, Status.FAILED, kind, describe(cause), elapsed, memoryDeltaBytes,
                Thread.currentThread().getName());
    }

    public static ProcessingResult createFailedResult(final String fileName, final ErrorKind kind, final Throwable cause) {
        return createFailedResult(fileName, kind, cause, Duration.ZERO, 0L);
    }

    // --- Status Determination ---

    /**
     * Overall status of a group of results: FAILED as soon as one result failed or fewer
     * results came back than tasks were submitted.
     */
    public static <T extends HasStatus> Status determineOverallStatus(
            final List<T> results,
            final int expectedTaskCount,
            final String levelName,
            final Object identifier) {

        final String idStr = identifier != null ? identifier.toString() : "N/A";

        final long failed = results.stream().filter(r -> r.status() == Status.FAILED).count();
        if (failed > 0) {
            LOGGER.warning(() -> "%s %s: FAILED (%d of %d sub-tasks failed).".formatted(levelName, idStr, failed, expectedTaskCount));
            return Status.FAILED;
        }
        if (results.size() < expectedTaskCount) {
            LOGGER.warning(() -> "%s %s: FAILED (missing results %d/%d).".formatted(levelName, idStr, results.size(), expectedTaskCount));
            return Status.FAILED;
        }
        LOGGER.fine(() -> "%s %s: SUCCESS (%d/%d sub-tasks succeeded).".formatted(levelName, idStr, results.size(), expectedTaskCount));
        return Status.SUCCESS;
    }

    private static String describe(final Throwable cause) {
        if (cause == null) return "unknown error";
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
