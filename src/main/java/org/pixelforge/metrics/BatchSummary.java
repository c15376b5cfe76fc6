package org.pixelforge.metrics;

import java.time.Duration;
import java.util.List;

/**
 * Aggregate over all {@link ProcessingResult}s of one pipeline invocation.
 * Always derived through {@link #of(Strategy, List, Duration)}.
 */
public record BatchSummary(Strategy strategy, int successCount, int failureCount, Duration totalElapsed,
                           Duration averagePerFile, long peakMemoryDeltaBytes, List<ProcessingResult> results) {

    public BatchSummary {
        results = List.copyOf(results);
    }

    public static BatchSummary of(final Strategy strategy, final List<ProcessingResult> results, final Duration totalElapsed) {
        final int success = (int) results.stream().filter(ProcessingResult::succeeded).count();
        final Duration average = results.isEmpty() ? Duration.ZERO : totalElapsed.dividedBy(results.size());
        final long peak = results.stream().mapToLong(ProcessingResult::memoryDeltaBytes).max().orElse(0L);
        return new BatchSummary(strategy, success, results.size() - success, totalElapsed, average, peak, results);
    }

    public int fileCount() {
        return successCount + failureCount;
    }

    public boolean allSucceeded() {
        return failureCount == 0;
    }
}
