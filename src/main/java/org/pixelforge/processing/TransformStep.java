package org.pixelforge.processing;

import org.pixelforge.config.TransformSpec;

import java.awt.image.BufferedImage;

/**
 * The five transform steps, declared in the order the chain applies them.
 */
public enum TransformStep {
    RESIZE {
        @Override
        BufferedImage transform(final BufferedImage raster, final TransformSpec spec) {
            return RasterOps.resize(raster, spec.resizeDimensions().width(), spec.resizeDimensions().height());
        }
    },
    BLUR {
        @Override
        BufferedImage transform(final BufferedImage raster, final TransformSpec spec) {
            return RasterOps.gaussianBlur(raster, spec.blurRadius());
        }
    },
    SHARPEN {
        @Override
        BufferedImage transform(final BufferedImage raster, final TransformSpec spec) {
            return RasterOps.sharpness(raster, spec.sharpenFactor());
        }
    },
    CONTRAST {
        @Override
        BufferedImage transform(final BufferedImage raster, final TransformSpec spec) {
            return RasterOps.contrast(raster, spec.contrastFactor());
        }
    },
    BRIGHTNESS {
        @Override
        BufferedImage transform(final BufferedImage raster, final TransformSpec spec) {
            return RasterOps.brightness(raster, spec.brightnessFactor());
        }
    };

    abstract BufferedImage transform(BufferedImage raster, TransformSpec spec);
}
