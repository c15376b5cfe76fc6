package org.pixelforge.processing;

import org.pixelforge.config.TransformSpec;
import org.pixelforge.metrics.*;
import org.pixelforge.util.FileUtils;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Profiles pipeline invocations: system info and process counters are sampled before and
 * after the run, per-file figures come from the batch results.
 */
public class ProcessingProfiler {

    private static final double BYTES_PER_MB = 1024.0 * 1024.0;

    private final ResourceSampler sampler;
    private final Clock clock;
    private final Logger logger;

    public ProcessingProfiler() {
        this(new ResourceSampler(), Clock.systemDefaultZone(), Logger.getLogger(ProcessingProfiler.class.getName()));
    }

    public ProcessingProfiler(final ResourceSampler sampler, final Clock clock, final Logger logger) {
        this.sampler = sampler;
        this.clock = clock;
        this.logger = logger;
    }

    public ProfileReport profile(final ImagePipeline pipeline, final Path inputDir, final Path outputDir,
                                 final TransformSpec spec) throws BatchFatalException {
        final String timestamp = LocalDateTime.now(clock).format(DateTimeFormatter.ISO_LOCAL_DATE_TIME);
        final SystemInfo before = sampler.systemInfo();
        final Measured<BatchSummary> measured = sampler.measure(() -> pipeline.process(inputDir, outputDir, spec));
        final SystemInfo after = sampler.systemInfo();

        final BatchSummary summary = measured.result();
        final ResourceDelta delta = measured.delta();
        final Map<String, FileStat> perFile = new LinkedHashMap<>();
        for (ProcessingResult r : summary.results()) {
            perFile.put(r.fileName(), new FileStat(r.elapsed().toNanos() / 1_000_000_000.0,
                    r.memoryDeltaBytes() / BYTES_PER_MB, r.status()));
        }
        final double average = summary.fileCount() == 0 ? 0.0 : delta.wallSeconds() / summary.fileCount();

        final ProfileReport report = new ProfileReport(timestamp, pipeline.strategy(), delta.wallSeconds(),
                delta.cpuSeconds(), delta.memoryMegabytes(), summary.peakMemoryDeltaBytes() / BYTES_PER_MB,
                average, summary.successCount(), summary.failureCount(), perFile, before, after);
        logger.info(() -> "Profiled %s run: %.2fs total, %.2fs CPU, %.3fs per file"
                .formatted(pipeline.strategy(), report.executionTimeSeconds(), report.cpuTimeSeconds(), average));
        return report;
    }

    /**
     * Profiles every variant {@code iterations} times, each pass writing into its own
     * {@code iteration_<n>} directory below {@code outputDir}.
     */
    public List<StressRun> stressTest(final ImagePipeline pipeline, final Path inputDir, final Path outputDir,
                                      final List<TransformSpec> variants, final int iterations)
            throws BatchFatalException {
        if (iterations <= 0) throw new IllegalArgumentException("iterations must be > 0, got " + iterations);
        final List<TransformSpec> params = variants == null || variants.isEmpty() ? TransformSpec.stressVariants() : variants;
        final List<StressRun> runs = new ArrayList<>(params.size() * iterations);
        for (TransformSpec spec : params) {
            for (int i = 0; i < iterations; i++) {
                final Path iterationOutput = outputDir.resolve("iteration_" + i);
                try {
                    FileUtils.recreateDirectory(iterationOutput);
                } catch (IOException e) {
                    throw new BatchFatalException("Cannot reset " + iterationOutput + ": " + e.getMessage(), e);
                }
                logger.fine(() -> "Stress pass with " + spec);
                runs.add(new StressRun(spec, i, profile(pipeline, inputDir, iterationOutput, spec)));
            }
        }
        return runs;
    }
}
