package org.pixelforge.processing;

import org.pixelforge.config.TransformSpec;
import org.pixelforge.metrics.ProcessingResult;
import org.pixelforge.metrics.ResourceSampler;
import org.pixelforge.metrics.Strategy;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Baseline strategy: one file after another on the calling thread, with a full decode/encode
 * round trip around every transform step.
 * <p>
 * Steps before the last are persisted to a lossless PNG staging file next to the output, so
 * the result matches the single-pass strategy pixel for pixel even when the target format is
 * lossy. The final step writes {@code processed_<name>} with default encoder settings and the
 * staging file is removed.
 */
public class SequentialMultipassPipeline extends AbstractImagePipeline {

    static final String STAGING_PREFIX = ".";
    static final String STAGING_SUFFIX = ".stage.png";

    public SequentialMultipassPipeline() {
        this(new ImageCodec(), new TransformChain(), new ResourceSampler(),
                Logger.getLogger(SequentialMultipassPipeline.class.getName()));
    }

    public SequentialMultipassPipeline(final ImageCodec codec, final TransformChain chain,
                                       final ResourceSampler sampler, final Logger logger) {
        super(codec, chain, sampler, logger);
    }

    @Override
    public Strategy strategy() {
        return Strategy.SEQUENTIAL;
    }

    @Override
    protected List<ProcessingResult> processAll(final List<ImageAsset> assets, final Path outputDir,
                                                final TransformSpec spec) {
        final List<ProcessingResult> results = new ArrayList<>(assets.size());
        for (ImageAsset asset : assets) {
            results.add(processMeasured(asset, outputDir, spec));
        }
        return results;
    }

    @Override
    protected void processFile(final ImageAsset asset, final Path outputDir, final TransformSpec spec)
            throws ImageProcessingException {
        final Path output = asset.outputPath(outputDir);
        final Path staging = stagingPath(output);
        final TransformStep[] steps = TransformStep.values();
        try {
            Path source = asset.path();
            for (int i = 0; i < steps.length; i++) {
                final BufferedImage raster = codec.decode(source);
                final BufferedImage transformed = chain.applyStep(steps[i], raster, spec);
                if (i == steps.length - 1) {
                    codec.encode(transformed, output, asset.outputFormat());
                } else {
                    codec.encode(transformed, staging, ImageFormat.PNG);
                    source = staging;
                }
            }
        } finally {
            removeStaging(staging);
        }
    }

    static Path stagingPath(final Path output) {
        return output.resolveSibling(STAGING_PREFIX + output.getFileName() + STAGING_SUFFIX);
    }

    private void removeStaging(final Path staging) {
        try {
            Files.deleteIfExists(staging);
        } catch (final IOException e) {
            logger.warning(() -> "Could not remove staging file " + staging + ": " + e.getMessage());
        }
    }
}
