package org.pixelforge.metrics;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StatusHelperTest {

    @Test
    void testCreateFailedResult_usesCauseMessage() {
        ProcessingResult result = StatusHelper.createFailedResult("a.jpg", ErrorKind.DECODE,
                new IllegalStateException("broken header"), Duration.ofMillis(12), 64L);

        assertEquals(Status.FAILED, result.status());
        assertEquals(ErrorKind.DECODE, result.errorKind());
        assertEquals("broken header", result.errorMessage());
        assertEquals(Duration.ofMillis(12), result.elapsed());
        assertEquals(64L, result.memoryDeltaBytes());
        assertEquals(Thread.currentThread().getName(), result.threadName());
        assertFalse(result.succeeded());
    }

    @Test
    void testCreateFailedResult_fallsBackToExceptionType() {
        ProcessingResult result = StatusHelper.createFailedResult("a.jpg", ErrorKind.UNEXPECTED, new NullPointerException());

        assertEquals("NullPointerException", result.errorMessage());
        assertEquals(Duration.ZERO, result.elapsed());
    }

    @Test
    void testDetermineOverallStatus() {
        ProcessingResult ok = StatusHelper.createSuccessResult("ok.png", Duration.ofMillis(5), 0L);
        ProcessingResult bad = StatusHelper.createFailedResult("bad.png", ErrorKind.ENCODE, new RuntimeException("x"));

        assertEquals(Status.SUCCESS, StatusHelper.determineOverallStatus(List.of(ok, ok), 2, "Test", "all-ok"));
        assertEquals(Status.FAILED, StatusHelper.determineOverallStatus(List.of(ok, bad), 2, "Test", "one-bad"));
        assertEquals(Status.FAILED, StatusHelper.determineOverallStatus(List.of(ok), 2, "Test", "missing"),
                "Fewer results than tasks means something was lost.");
    }

    @Test
    void testBatchSummary_of() {
        List<ProcessingResult> results = List.of(
                StatusHelper.createSuccessResult("a.png", Duration.ofMillis(10), 100L),
                StatusHelper.createSuccessResult("b.png", Duration.ofMillis(20), 300L),
                StatusHelper.createFailedResult("c.png", ErrorKind.DECODE, new RuntimeException("bad"), Duration.ofMillis(1), 50L));

        BatchSummary summary = BatchSummary.of(Strategy.PARALLEL, results, Duration.ofMillis(90));

        assertEquals(2, summary.successCount());
        assertEquals(1, summary.failureCount());
        assertEquals(3, summary.fileCount());
        assertEquals(Duration.ofMillis(30), summary.averagePerFile());
        assertEquals(300L, summary.peakMemoryDeltaBytes());
        assertFalse(summary.allSucceeded());
    }

    @Test
    void testBatchSummary_emptyBatch() {
        BatchSummary summary = BatchSummary.of(Strategy.SEQUENTIAL, List.of(), Duration.ofMillis(3));

        assertEquals(0, summary.fileCount());
        assertEquals(Duration.ZERO, summary.averagePerFile());
        assertEquals(0L, summary.peakMemoryDeltaBytes());
        assertTrue(summary.allSucceeded());
    }
}
