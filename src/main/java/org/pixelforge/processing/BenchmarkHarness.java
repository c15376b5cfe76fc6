package org.pixelforge.processing;

import org.pixelforge.config.TransformSpec;
import org.pixelforge.metrics.*;
import org.pixelforge.util.FileUtils;
import org.pixelforge.util.TestImageGenerator;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.function.ToDoubleFunction;
import java.util.logging.Logger;

/**
 * Runs both pipeline strategies over the same inputs for every (variant, iteration) pair and
 * records what each run cost.
 * <p>
 * Output directories are recreated before every run, so no iteration sees files written by
 * a previous one. Resource sampling happens on the calling thread, around the whole pipeline
 * invocation.
 */
public class BenchmarkHarness {

    /**
     * Supplies the input directory for one (variant, iteration) pair.
     */
    @FunctionalInterface
    public interface InputProvider {

        Path prepare(int variantIndex, int iteration) throws IOException;

        /**
         * Fresh generated images for every call, written into {@code dir}.
         */
        static InputProvider generated(final Path dir, final int count, final int width, final int height) {
            return (variantIndex, iteration) -> {
                FileUtils.recreateDirectory(dir);
                TestImageGenerator.generate(dir, count, width, height);
                return dir;
            };
        }

        /**
         * An existing directory, used as is for every run.
         */
        static InputProvider provided(final Path dir) {
            return (variantIndex, iteration) -> dir;
        }
    }

    private final ImagePipeline sequential;
    private final ImagePipeline parallel;
    private final InputProvider inputs;
    private final Path workDir;
    private final ResourceSampler sampler;
    private final Logger logger;

    public BenchmarkHarness(final ImagePipeline sequential, final ImagePipeline parallel,
                            final InputProvider inputs, final Path workDir) {
        this(sequential, parallel, inputs, workDir, new ResourceSampler(),
                Logger.getLogger(BenchmarkHarness.class.getName()));
    }

    public BenchmarkHarness(final ImagePipeline sequential, final ImagePipeline parallel,
                            final InputProvider inputs, final Path workDir,
                            final ResourceSampler sampler, final Logger logger) {
        this.sequential = Objects.requireNonNull(sequential, "sequential pipeline cannot be null");
        this.parallel = Objects.requireNonNull(parallel, "parallel pipeline cannot be null");
        this.inputs = Objects.requireNonNull(inputs, "input provider cannot be null");
        this.workDir = Objects.requireNonNull(workDir, "work directory cannot be null");
        this.sampler = sampler;
        this.logger = logger;
    }

    /**
     * @return {@code 2 * variants.size() * iterations} records, sequential before parallel
     * within each (variant, iteration)
     */
    public List<BenchmarkRecord> compare(final List<TransformSpec> variants, final int iterations)
            throws BatchFatalException {
        return compare(variants, iterations, inputs, workDir.resolve("output"));
    }

    /**
     * Runs {@link #compare} once per scenario, each on its own generated input set.
     *
     * @return records keyed by scenario name, in scenario order
     */
    public Map<String, List<BenchmarkRecord>> runScenarios(final List<BenchmarkScenario> scenarios,
                                                           final TransformSpec spec, final int iterations)
            throws BatchFatalException {
        final Map<String, List<BenchmarkRecord>> byScenario = new LinkedHashMap<>();
        for (BenchmarkScenario scenario : scenarios) {
            if (byScenario.containsKey(scenario.name()))
                throw new IllegalArgumentException("Duplicate scenario name: " + scenario.name());
            logger.info(() -> "Running benchmark scenario %s: %d images of %dx%d"
                    .formatted(scenario.name(), scenario.imageCount(), scenario.imageWidth(), scenario.imageHeight()));
            final InputProvider scenarioInputs = InputProvider.generated(
                    workDir.resolve("input").resolve(scenario.name()),
                    scenario.imageCount(), scenario.imageWidth(), scenario.imageHeight());
            byScenario.put(scenario.name(), compare(List.of(spec), iterations, scenarioInputs,
                    workDir.resolve("output").resolve(scenario.name())));
        }
        return byScenario;
    }

    private List<BenchmarkRecord> compare(final List<TransformSpec> variants, final int iterations,
                                          final InputProvider provider, final Path outputRoot)
            throws BatchFatalException {
        if (iterations <= 0) throw new IllegalArgumentException("iterations must be > 0, got " + iterations);
        final List<BenchmarkRecord> records = new ArrayList<>(2 * variants.size() * iterations);

        for (int v = 0; v < variants.size(); v++) {
            final TransformSpec variant = variants.get(v);
            for (int i = 0; i < iterations; i++) {
                final int variantIndex = v;
                final int iteration = i;
                logger.info(() -> "Variant %d (%s), iteration %d/%d".formatted(variantIndex, variant.resizeDimensions(),
                        iteration + 1, iterations));
                final Path inputDir = prepareInputs(provider, v, i);
                for (ImagePipeline pipeline : List.of(sequential, parallel)) {
                    records.add(runOnce(pipeline, v, variant, i, inputDir, outputRoot));
                }
            }
        }
        return records;
    }

    private BenchmarkRecord runOnce(final ImagePipeline pipeline, final int variantIndex, final TransformSpec variant,
                                    final int iteration, final Path inputDir, final Path outputRoot)
            throws BatchFatalException {
        final Path outputDir = outputRoot.resolve(pipeline.strategy().name().toLowerCase(Locale.ROOT));
        try {
            FileUtils.recreateDirectory(outputDir);
        } catch (IOException e) {
            throw new BatchFatalException("Cannot reset output directory " + outputDir + ": " + e.getMessage(), e);
        }

        final Measured<BatchSummary> measured = sampler.measure(() -> pipeline.process(inputDir, outputDir, variant));
        final ResourceDelta delta = measured.delta();
        logger.info(() -> "%s: time=%.2fs, memory=%.2fMB, cpu=%.2fs".formatted(pipeline.strategy(),
                delta.wallSeconds(), delta.memoryMegabytes(), delta.cpuSeconds()));
        return new BenchmarkRecord(variantIndex, variant, iteration, pipeline.strategy(), measured.result(), delta);
    }

    private static Path prepareInputs(final InputProvider provider, final int variantIndex, final int iteration)
            throws BatchFatalException {
        try {
            final Path dir = provider.prepare(variantIndex, iteration);
            if (dir == null || !Files.isDirectory(dir))
                throw new BatchFatalException("Benchmark input directory not available: " + dir);
            return dir;
        } catch (IOException e) {
            throw new BatchFatalException("Cannot prepare benchmark inputs: " + e.getMessage(), e);
        }
    }

    /**
     * Means per (variant, strategy), ordered by variant index then strategy. The records are
     * only read.
     */
    public static List<BenchmarkAggregate> aggregate(final List<BenchmarkRecord> records) {
        final Map<AggregateKey, List<BenchmarkRecord>> groups = new TreeMap<>(
                Comparator.comparingInt(AggregateKey::variantIndex).thenComparing(AggregateKey::strategy));
        for (BenchmarkRecord r : records) {
            groups.computeIfAbsent(new AggregateKey(r.variantIndex(), r.strategy()), k -> new ArrayList<>()).add(r);
        }

        final List<BenchmarkAggregate> aggregates = new ArrayList<>(groups.size());
        for (Map.Entry<AggregateKey, List<BenchmarkRecord>> entry : groups.entrySet()) {
            final List<BenchmarkRecord> group = entry.getValue();
            aggregates.add(new BenchmarkAggregate(entry.getKey().variantIndex(), group.get(0).variant(),
                    entry.getKey().strategy(), group.size(),
                    mean(group, r -> r.resources().wallSeconds()),
                    mean(group, r -> r.resources().cpuSeconds()),
                    mean(group, r -> r.resources().memoryMegabytes()),
                    mean(group, r -> r.summary().successCount()),
                    mean(group, r -> r.summary().failureCount())));
        }
        return aggregates;
    }

    /**
     * Sequential mean wall time divided by parallel mean wall time for one variant;
     * {@code NaN} when the parallel mean is not positive.
     *
     * @throws IllegalArgumentException if either strategy has no aggregate for the variant
     */
    public static double speedup(final List<BenchmarkAggregate> aggregates, final int variantIndex) {
        final BenchmarkAggregate seq = find(aggregates, variantIndex, Strategy.SEQUENTIAL);
        final BenchmarkAggregate par = find(aggregates, variantIndex, Strategy.PARALLEL);
        return par.meanWallSeconds() > 0 ? seq.meanWallSeconds() / par.meanWallSeconds() : Double.NaN;
    }

    private static BenchmarkAggregate find(final List<BenchmarkAggregate> aggregates, final int variantIndex,
                                           final Strategy strategy) {
        return aggregates.stream()
                .filter(a -> a.variantIndex() == variantIndex && a.strategy() == strategy)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException(
                        "No %s aggregate for variant %d".formatted(strategy, variantIndex)));
    }

    private static double mean(final List<BenchmarkRecord> group,
                               final ToDoubleFunction<BenchmarkRecord> metric) {
        return group.stream().mapToDouble(metric).average().orElse(0.0);
    }

    private record AggregateKey(int variantIndex, Strategy strategy) {
    }
}
