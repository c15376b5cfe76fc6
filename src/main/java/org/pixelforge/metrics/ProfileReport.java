package org.pixelforge.metrics;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Profiling record of one pipeline invocation, in the shape consumed by the JSON report.
 * Times are in seconds and memory figures in megabytes.
 */
public record ProfileReport(String timestamp, Strategy strategy, double executionTimeSeconds,
                            double cpuTimeSeconds, double memoryDeltaMegabytes, double peakMemoryMegabytes,
                            double averageTimePerFileSeconds, int successCount, int failureCount,
                            Map<String, FileStat> perFileStats, SystemInfo systemInfoBefore,
                            SystemInfo systemInfoAfter) {

    public ProfileReport {
        perFileStats = Collections.unmodifiableMap(new LinkedHashMap<>(perFileStats));
    }
}
