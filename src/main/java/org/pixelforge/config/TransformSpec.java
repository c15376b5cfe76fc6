package org.pixelforge.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable parameter bundle for one processing run. One instance is shared read-only
 * by every worker of that run.
 * <p>
 * Construction does not range-check the values; {@link #violations()} lists what is wrong
 * and the transform chain refuses to run an invalid spec.
 *
 * @param resizeDimensions target raster size
 * @param blurRadius       Gaussian blur radius, 0 disables the blur
 * @param sharpenFactor    1.0 leaves sharpness unchanged
 * @param contrastFactor   1.0 leaves contrast unchanged
 * @param brightnessFactor 1.0 leaves brightness unchanged
 */
public record TransformSpec(Dimensions resizeDimensions, double blurRadius, double sharpenFactor,
                            double contrastFactor, double brightnessFactor) {

    public record Dimensions(int width, int height) {
        @Override
        public String toString() {
            return width + "x" + height;
        }
    }

    public static final TransformSpec DEFAULTS = new TransformSpec(new Dimensions(800, 600), 1.0, 1.5, 1.2, 1.1);

    public TransformSpec {
        Objects.requireNonNull(resizeDimensions, "Resize dimensions cannot be null");
    }

    public static TransformSpec of(int width, int height, double blurRadius, double sharpenFactor,
                                   double contrastFactor, double brightnessFactor) {
        return new TransformSpec(new Dimensions(width, height), blurRadius, sharpenFactor, contrastFactor, brightnessFactor);
    }

    /**
     * The parameter variations exercised by a stress run: default, medium and heavy.
     */
    public static List<TransformSpec> stressVariants() {
        return List.of(
                DEFAULTS,
                of(1024, 768, 2.0, 2.0, 1.5, 1.3),
                of(1920, 1080, 3.0, 2.5, 1.8, 1.5));
    }

    /**
     * @return human-readable problems with this spec, empty when it can be applied
     */
    public List<String> violations() {
        final List<String> problems = new ArrayList<>();
        if (resizeDimensions.width() <= 0 || resizeDimensions.height() <= 0)
            problems.add("resize dimensions must be positive, got " + resizeDimensions);
        checkFactor(problems, "blur radius", blurRadius);
        checkFactor(problems, "sharpen factor", sharpenFactor);
        checkFactor(problems, "contrast factor", contrastFactor);
        checkFactor(problems, "brightness factor", brightnessFactor);
        return problems;
    }

    private static void checkFactor(final List<String> problems, final String name, final double value) {
        if (Double.isNaN(value) || value < 0)
            problems.add(name + " must be non-negative, got " + value);
    }
}
