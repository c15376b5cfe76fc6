package org.pixelforge.metrics;

/**
 * Host-level figures recorded around a profiled run. {@code cpuPercent} is negative
 * when the platform cannot report it.
 */
public record SystemInfo(int cpuCount, double cpuPercent, long memoryTotalBytes, long memoryAvailableBytes) {
}
