package org.pixelforge.processing;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Image container formats, keyed by file extension.
 */
public enum ImageFormat {
    JPEG("jpeg", false, ".jpg", ".jpeg"),
    PNG("png", true, ".png"),
    BMP("bmp", false, ".bmp"),
    TIFF("tiff", true, ".tiff"),
    UNKNOWN(null, false);

    private final String imageIoName;
    private final boolean alphaCapable;
    private final String[] extensions;

    ImageFormat(final String imageIoName, final boolean alphaCapable, final String... extensions) {
        this.imageIoName = imageIoName;
        this.alphaCapable = alphaCapable;
        this.extensions = extensions;
    }

    /**
     * Format named by the file's extension, {@link #UNKNOWN} if it is not one of the supported set.
     */
    public static ImageFormat detect(final String fileName) {
        final String lower = fileName.toLowerCase(Locale.ROOT);
        for (ImageFormat format : values()) {
            for (String ext : format.extensions) {
                if (lower.endsWith(ext)) return format;
            }
        }
        return UNKNOWN;
    }

    /**
     * Encode format for an output file name. Anything unrecognized is written as JPEG.
     */
    public static ImageFormat select(final String fileName) {
        final ImageFormat detected = detect(fileName);
        return detected == UNKNOWN ? JPEG : detected;
    }

    public static boolean isSupported(final Path path) {
        return detect(path.getFileName().toString()) != UNKNOWN;
    }

    public String imageIoName() {
        return imageIoName;
    }

    public boolean alphaCapable() {
        return alphaCapable;
    }
}
