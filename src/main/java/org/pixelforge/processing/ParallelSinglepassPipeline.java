package org.pixelforge.processing;

import org.pixelforge.config.TransformSpec;
import org.pixelforge.metrics.ProcessingResult;
import org.pixelforge.metrics.ResourceSampler;
import org.pixelforge.metrics.Strategy;

import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Optimized strategy: each file is decoded once, run through the whole chain in memory and
 * encoded once with {@link ImageCodec.EncodeMode#OPTIMIZED}; files are spread over a
 * {@link WorkerPool} of at most {@code maxWorkers} threads.
 */
public class ParallelSinglepassPipeline extends AbstractImagePipeline {

    private final int maxWorkers;
    private final WorkerPool workerPool;

    public ParallelSinglepassPipeline() {
        this(WorkerPool.DEFAULT_MAX_WORKERS);
    }

    public ParallelSinglepassPipeline(final int maxWorkers) {
        this(maxWorkers, new ImageCodec(), new TransformChain(), new ResourceSampler(), new WorkerPool(),
                Logger.getLogger(ParallelSinglepassPipeline.class.getName()));
    }

    public ParallelSinglepassPipeline(final int maxWorkers, final ImageCodec codec, final TransformChain chain,
                                      final ResourceSampler sampler, final WorkerPool workerPool, final Logger logger) {
        super(codec, chain, sampler, logger);
        if (maxWorkers <= 0) throw new IllegalArgumentException("maxWorkers must be > 0, got " + maxWorkers);
        this.maxWorkers = maxWorkers;
        this.workerPool = workerPool;
    }

    @Override
    public Strategy strategy() {
        return Strategy.PARALLEL;
    }

    public int maxWorkers() {
        return maxWorkers;
    }

    @Override
    protected List<ProcessingResult> processAll(final List<ImageAsset> assets, final Path outputDir,
                                                final TransformSpec spec) {
        final Map<Path, ImageAsset> byPath = new HashMap<>();
        for (ImageAsset asset : assets) byPath.put(asset.path(), asset);
        final List<Path> files = assets.stream().map(ImageAsset::path).toList();
        return workerPool.run(files, file -> processMeasured(byPath.get(file), outputDir, spec), maxWorkers);
    }

    @Override
    protected void processFile(final ImageAsset asset, final Path outputDir, final TransformSpec spec)
            throws ImageProcessingException {
        final BufferedImage raster = codec.decode(asset.path());
        final BufferedImage transformed = chain.apply(raster, spec);
        codec.encode(transformed, asset.outputPath(outputDir), asset.outputFormat(), ImageCodec.EncodeMode.OPTIMIZED);
    }
}
