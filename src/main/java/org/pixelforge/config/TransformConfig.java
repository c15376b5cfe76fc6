package org.pixelforge.config;

/**
 * YAML shape of a {@link TransformSpec}. Absent values take the defaults.
 */
public record TransformConfig(Integer resizeWidth, Integer resizeHeight, Double blurRadius, Double sharpenFactor,
                              Double contrastFactor, Double brightnessFactor) {

    public TransformSpec toSpec() {
        final TransformSpec d = TransformSpec.DEFAULTS;
        return TransformSpec.of(
                resizeWidth != null ? resizeWidth : d.resizeDimensions().width(),
                resizeHeight != null ? resizeHeight : d.resizeDimensions().height(),
                blurRadius != null ? blurRadius : d.blurRadius(),
                sharpenFactor != null ? sharpenFactor : d.sharpenFactor(),
                contrastFactor != null ? contrastFactor : d.contrastFactor(),
                brightnessFactor != null ? brightnessFactor : d.brightnessFactor());
    }
}
