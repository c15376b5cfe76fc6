package org.pixelforge.metrics;

public record FileStat(double executionTimeSeconds, double peakMemoryMegabytes, Status status) {
}
