package org.pixelforge.config;

import java.nio.file.Path;
import java.util.List;

/**
 * Benchmark session settings. Without variants the stress variants are used.
 */
public record BenchmarkConfig(Path workDir, Integer iterations, Integer imageCount, Integer imageWidth,
                              Integer imageHeight, List<TransformConfig> variants) {

    public static final BenchmarkConfig DEFAULTS = new BenchmarkConfig(null, null, null, null, null, null);

    public BenchmarkConfig {
        workDir = workDir != null ? workDir : Path.of("data", "benchmark");
        iterations = iterations != null ? iterations : 3;
        imageCount = imageCount != null ? imageCount : 5;
        imageWidth = imageWidth != null ? imageWidth : 1920;
        imageHeight = imageHeight != null ? imageHeight : 1080;
        variants = variants != null ? List.copyOf(variants) : List.of();
        requirePositive("iterations", iterations);
        requirePositive("imageCount", imageCount);
        requirePositive("imageWidth", imageWidth);
        requirePositive("imageHeight", imageHeight);
    }

    private static void requirePositive(final String name, final int value) {
        if (value <= 0) throw new IllegalArgumentException("benchmark." + name + " must be > 0, got " + value);
    }

    public List<TransformSpec> variantSpecs() {
        if (variants.isEmpty()) return TransformSpec.stressVariants();
        return variants.stream().map(TransformConfig::toSpec).toList();
    }
}
