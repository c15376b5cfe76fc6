package org.pixelforge.processing;

import org.pixelforge.config.TransformSpec;

import java.awt.image.BufferedImage;
import java.util.List;

/**
 * Applies resize, blur, sharpen, contrast and brightness to one raster, in that order.
 * <p>
 * Pure: the input raster is never modified and each step hands a fresh raster to the next.
 * Instances keep no state and are shared by all workers.
 */
public class TransformChain {

    public BufferedImage apply(final BufferedImage raster, final TransformSpec spec) throws TransformException {
        validate(spec);
        BufferedImage current = raster;
        for (TransformStep step : TransformStep.values()) {
            current = run(step, current, spec);
        }
        return current;
    }

    /**
     * Runs a single step; the multipass pipeline persists the raster between calls.
     */
    public BufferedImage applyStep(final TransformStep step, final BufferedImage raster, final TransformSpec spec)
            throws TransformException {
        validate(spec);
        return run(step, raster, spec);
    }

    private static BufferedImage run(final TransformStep step, final BufferedImage raster, final TransformSpec spec)
            throws TransformException {
        requireUsable(raster, step, "input");
        final BufferedImage result;
        try {
            result = step.transform(raster, spec);
        } catch (RuntimeException e) {
            throw new TransformException("%s step failed: %s".formatted(step, e.getMessage()), e);
        }
        requireUsable(result, step, "output");
        if (step == TransformStep.RESIZE
                && (result.getWidth() != spec.resizeDimensions().width() || result.getHeight() != spec.resizeDimensions().height()))
            throw new TransformException("Resize produced %dx%d instead of %s"
                    .formatted(result.getWidth(), result.getHeight(), spec.resizeDimensions()));
        return result;
    }

    private static void validate(final TransformSpec spec) throws TransformException {
        if (spec == null) throw new TransformException("Transform spec cannot be null");
        final List<String> violations = spec.violations();
        if (!violations.isEmpty())
            throw new TransformException("Invalid transform spec: " + String.join("; ", violations));
    }

    private static void requireUsable(final BufferedImage raster, final TransformStep step, final String side)
            throws TransformException {
        if (raster == null || raster.getWidth() <= 0 || raster.getHeight() <= 0)
            throw new TransformException("Invalid raster as %s of %s step".formatted(side, step));
    }
}
