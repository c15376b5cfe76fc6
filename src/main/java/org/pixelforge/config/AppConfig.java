package org.pixelforge.config;

import java.nio.file.Path;

public record AppConfig(Path inputDir, Path outputDir, Path reportsDir, Integer maxWorkers, String logLevel,
                        Path logFile, TransformConfig transform, BenchmarkConfig benchmark) {

    public static final int DEFAULT_MAX_WORKERS = 4;

    public AppConfig {
        inputDir = inputDir != null ? inputDir : Path.of("data", "input");
        outputDir = outputDir != null ? outputDir : Path.of("data", "output");
        reportsDir = reportsDir != null ? reportsDir : Path.of("reports");
        maxWorkers = maxWorkers != null ? maxWorkers : DEFAULT_MAX_WORKERS;
        if (maxWorkers <= 0) throw new IllegalArgumentException("maxWorkers must be > 0, got " + maxWorkers);
        logLevel = logLevel != null ? logLevel : "INFO";
        transform = transform != null ? transform : new TransformConfig(null, null, null, null, null, null);
        benchmark = benchmark != null ? benchmark : BenchmarkConfig.DEFAULTS;
    }

    public TransformSpec transformSpec() {
        return transform.toSpec();
    }
}
