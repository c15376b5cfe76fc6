package org.pixelforge.processing;

import org.pixelforge.config.TransformSpec;
import org.pixelforge.metrics.BatchSummary;
import org.pixelforge.metrics.Strategy;

import java.nio.file.Path;

/**
 * Transforms every supported image in {@code inputDir} into {@code outputDir}.
 * Implementations differ only in how decode, transform and encode are scheduled.
 */
public interface ImagePipeline {

    /**
     * @return one result per supported input file, failed files included
     * @throws BatchFatalException if the input directory cannot be used or the output directory cannot be created
     */
    BatchSummary process(Path inputDir, Path outputDir, TransformSpec spec) throws BatchFatalException;

    Strategy strategy();
}
