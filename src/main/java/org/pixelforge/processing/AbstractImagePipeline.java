package org.pixelforge.processing;

import org.pixelforge.config.TransformSpec;
import org.pixelforge.metrics.*;
import org.pixelforge.util.FileUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Shared batch handling for both strategies: input discovery, output directory bootstrapping,
 * per-file measurement and failure capture, and the batch summary.
 * Subclasses decide how files are scheduled and how a single file is processed.
 */
public abstract class AbstractImagePipeline implements ImagePipeline {

    protected final ImageCodec codec;
    protected final TransformChain chain;
    protected final ResourceSampler sampler;
    protected final Logger logger;

    protected AbstractImagePipeline(final ImageCodec codec, final TransformChain chain,
                                    final ResourceSampler sampler, final Logger logger) {
        this.codec = Objects.requireNonNull(codec, "codec cannot be null");
        this.chain = Objects.requireNonNull(chain, "chain cannot be null");
        this.sampler = Objects.requireNonNull(sampler, "sampler cannot be null");
        this.logger = Objects.requireNonNull(logger, "logger cannot be null");
    }

    @Override
    public final BatchSummary process(final Path inputDir, final Path outputDir, final TransformSpec spec)
            throws BatchFatalException {
        Objects.requireNonNull(spec, "Transform spec cannot be null");
        final List<ImageAsset> assets = discover(inputDir);
        prepareOutputDirectory(outputDir);

        logger.info(() -> "%s pipeline: processing %d images from %s into %s"
                .formatted(strategy(), assets.size(), inputDir, outputDir));
        final long start = System.nanoTime();
        final List<ProcessingResult> results = assets.isEmpty() ? List.of() : processAll(assets, outputDir, spec);
        final BatchSummary summary = BatchSummary.of(strategy(), results, Duration.ofNanos(System.nanoTime() - start));

        final Status overall = StatusHelper.determineOverallStatus(results, assets.size(), strategy() + " batch", inputDir);
        logger.info(() -> "%s pipeline finished %s in %d ms: %d succeeded, %d failed"
                .formatted(strategy(), overall, summary.totalElapsed().toMillis(), summary.successCount(), summary.failureCount()));
        return summary;
    }

    /**
     * Processes all assets, returning exactly one result per asset.
     */
    protected abstract List<ProcessingResult> processAll(List<ImageAsset> assets, Path outputDir, TransformSpec spec);

    /**
     * Reads {@code asset}, transforms it and writes {@code processed_<name>} into {@code outputDir}.
     */
    protected abstract void processFile(ImageAsset asset, Path outputDir, TransformSpec spec)
            throws ImageProcessingException;

    /**
     * Runs {@link #processFile} for one asset and converts the outcome into a result.
     * Per-file failures are logged and recorded, never rethrown.
     */
    protected ProcessingResult processMeasured(final ImageAsset asset, final Path outputDir, final TransformSpec spec) {
        final ResourceSnapshot before = sampler.snapshot();
        try {
            processFile(asset, outputDir, spec);
            final ResourceDelta delta = before.deltaTo(sampler.snapshot());
            logger.fine(() -> "Processed %s in %d ms".formatted(asset.fileName(), delta.wallTime().toMillis()));
            return StatusHelper.createSuccessResult(asset.fileName(), delta.wallTime(), delta.memoryBytes());
        } catch (final ImageProcessingException e) {
            final ResourceDelta delta = before.deltaTo(sampler.snapshot());
            logger.warning(() -> "Failed to process %s (%s): %s".formatted(asset.fileName(), e.kind(), e.getMessage()));
            return StatusHelper.createFailedResult(asset.fileName(), e.kind(), e, delta.wallTime(), delta.memoryBytes());
        } catch (final RuntimeException e) {
            final ResourceDelta delta = before.deltaTo(sampler.snapshot());
            logger.log(Level.WARNING, "Unexpected error processing " + asset.fileName(), e);
            return StatusHelper.createFailedResult(asset.fileName(), ErrorKind.UNEXPECTED, e, delta.wallTime(), delta.memoryBytes());
        }
    }

    List<ImageAsset> discover(final Path inputDir) throws BatchFatalException {
        if (inputDir == null || !Files.exists(inputDir))
            throw new BatchFatalException("Input directory not found: " + inputDir);
        if (!Files.isDirectory(inputDir))
            throw new BatchFatalException("Input path is not a directory: " + inputDir);
        if (!Files.isReadable(inputDir))
            throw new BatchFatalException("Input directory is not readable: " + inputDir);

        final List<Path> files;
        try {
            files = FileUtils.listFiles(inputDir, (String) null);
        } catch (final IOException e) {
            throw new BatchFatalException("Cannot list input directory " + inputDir + ": " + e.getMessage(), e);
        }
        if (files.isEmpty()) throw new BatchFatalException("Input directory is empty: " + inputDir);

        final List<ImageAsset> assets = files.stream()
                .filter(ImageFormat::isSupported)
                .map(ImageAsset::of)
                .toList();
        if (assets.isEmpty())
            logger.warning(() -> "No supported image files in " + inputDir + " (" + files.size() + " files ignored)");
        else if (assets.size() < files.size())
            logger.fine(() -> "Ignoring %d unsupported files in %s".formatted(files.size() - assets.size(), inputDir));
        return assets;
    }

    void prepareOutputDirectory(final Path outputDir) throws BatchFatalException {
        if (outputDir == null) throw new BatchFatalException("Output directory not set");
        try {
            Files.createDirectories(outputDir);
            if (!FileUtils.isEmptyDirectory(outputDir))
                logger.fine(() -> "Output directory " + outputDir + " is not empty, existing outputs will be overwritten");
        } catch (final IOException e) {
            throw new BatchFatalException("Cannot create output directory " + outputDir + ": " + e.getMessage(), e);
        }
    }
}
