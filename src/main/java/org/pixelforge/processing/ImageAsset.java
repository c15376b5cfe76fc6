package org.pixelforge.processing;

import java.nio.file.Path;

public record ImageAsset(Path path, ImageFormat detectedFormat) {

    public static final String OUTPUT_PREFIX = "processed_";

    public static ImageAsset of(final Path path) {
        return new ImageAsset(path, ImageFormat.detect(path.getFileName().toString()));
    }

    public String fileName() {
        return path.getFileName().toString();
    }

    public ImageFormat outputFormat() {
        return detectedFormat == ImageFormat.UNKNOWN ? ImageFormat.JPEG : detectedFormat;
    }

    public Path outputPath(final Path outputDir) {
        return outputDir.resolve(OUTPUT_PREFIX + fileName());
    }
}
