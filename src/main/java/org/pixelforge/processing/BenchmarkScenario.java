package org.pixelforge.processing;

import java.util.List;

/**
 * A named benchmark input set: {@code imageCount} generated images of the given size.
 */
public record BenchmarkScenario(String name, int imageCount, int imageWidth, int imageHeight) {

    public static BenchmarkScenario count(final int imageCount) {
        return new BenchmarkScenario("count_" + imageCount, imageCount, 1920, 1080);
    }

    public static BenchmarkScenario size(final int width, final int height) {
        return new BenchmarkScenario("size_%dx%d".formatted(width, height), 5, width, height);
    }

    /**
     * Image-count series followed by image-size series.
     */
    public static List<BenchmarkScenario> defaultSeries() {
        return List.of(count(5), count(10), count(20),
                size(640, 480), size(1280, 720), size(1920, 1080), size(3840, 2160));
    }
}
