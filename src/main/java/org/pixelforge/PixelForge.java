package org.pixelforge;

import org.pixelforge.config.AppConfig;
import org.pixelforge.config.BenchmarkConfig;
import org.pixelforge.config.ConfigManager;
import org.pixelforge.metrics.*;
import org.pixelforge.processing.*;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Command line entry point.
 * <p>
 * Usage: {@code PixelForge [process|profile|stress|benchmark|scenarios] [configPath]}, default {@code process}.
 * <ul>
 *     <li>{@code process}: runs the parallel pipeline over the configured input directory.</li>
 *     <li>{@code profile}: profiles one sequential run and writes a JSON profile report.</li>
 *     <li>{@code stress}: profiles the sequential pipeline for every benchmark variant and iteration.</li>
 *     <li>{@code benchmark}: compares both strategies on generated inputs for every configured variant.</li>
 *     <li>{@code scenarios}: compares both strategies over the image-count and image-size series.</li>
 * </ul>
 * Exit code 0 on success, 1 when the run could not complete. Files that fail individually
 * do not change the exit code.
 */
public class PixelForge {
    private static final Logger LOGGER = Logger.getLogger(PixelForge.class.getName());

    public static final String DEFAULT_COMMAND = "process";

    /**
     * Result of one command. {@code cause} is null on success.
     */
    public record RunOutcome(boolean success, String cause) {
        static RunOutcome ok() {
            return new RunOutcome(true, null);
        }

        static RunOutcome failed(final String cause) {
            return new RunOutcome(false, cause);
        }
    }

    private final AppConfig appConfig;

    public PixelForge(final AppConfig appConfig) {
        this.appConfig = Objects.requireNonNull(appConfig, "Application configuration cannot be null");
    }

    // --- Main Method ---
    public static void main(final String[] args) {
        System.exit(run(args));
    }

    static int run(final String[] args) {
        final String command = args.length > 0 ? args[0] : DEFAULT_COMMAND;
        final Path configPath = args.length > 1 ? Path.of(args[1]) : null;

        final AppConfig appConfig;
        try {
            appConfig = ConfigManager.getConfig(configPath);
            ConfigManager.configureLogging(appConfig.logLevel(), appConfig.logFile());
        } catch (final IOException | IllegalArgumentException e) {
            System.err.println("Error: cannot load configuration: " + e.getMessage());
            return 1;
        }

        final RunOutcome outcome = new PixelForge(appConfig).execute(command);
        if (!outcome.success()) {
            System.err.println("Error: " + outcome.cause());
            return 1;
        }
        return 0;
    }

    public RunOutcome execute(final String command) {
        final String name = command == null ? DEFAULT_COMMAND : command.trim().toLowerCase(Locale.ROOT);
        try {
            return switch (name) {
                case "process" -> process();
                case "profile" -> profile();
                case "stress" -> stress();
                case "benchmark" -> benchmark();
                case "scenarios" -> scenarios();
                default -> RunOutcome.failed("Unknown command: " + command);
            };
        } catch (final BatchFatalException e) {
            LOGGER.log(Level.SEVERE, "Batch aborted: " + e.getMessage(), e);
            return RunOutcome.failed(e.getMessage());
        } catch (final IOException e) {
            LOGGER.log(Level.SEVERE, "I/O failure: " + e.getMessage(), e);
            return RunOutcome.failed("I/O error: " + e.getMessage());
        } catch (final IllegalArgumentException e) {
            LOGGER.log(Level.SEVERE, "Invalid setting: " + e.getMessage(), e);
            return RunOutcome.failed("Invalid setting: " + e.getMessage());
        }
    }

    private RunOutcome process() throws BatchFatalException {
        final ImagePipeline pipeline = new ParallelSinglepassPipeline(appConfig.maxWorkers());
        final BatchSummary summary = pipeline.process(appConfig.inputDir(), appConfig.outputDir(), appConfig.transformSpec());
        printSummary(summary);
        return RunOutcome.ok();
    }

    private RunOutcome profile() throws BatchFatalException, IOException {
        final ProfileReport report = new ProcessingProfiler().profile(new SequentialMultipassPipeline(),
                appConfig.inputDir(), appConfig.outputDir(), appConfig.transformSpec());
        final Path written = new ReportWriter(appConfig.reportsDir()).writeProfile(report);
        System.out.printf("Profile: %.2fs total, %.3fs per file, peak %.2f MB -> %s%n",
                report.executionTimeSeconds(), report.averageTimePerFileSeconds(), report.peakMemoryMegabytes(), written);
        return RunOutcome.ok();
    }

    private RunOutcome stress() throws BatchFatalException, IOException {
        final BenchmarkConfig bench = appConfig.benchmark();
        final List<StressRun> runs = new ProcessingProfiler().stressTest(new SequentialMultipassPipeline(),
                appConfig.inputDir(), appConfig.outputDir(), bench.variantSpecs(), bench.iterations());
        final Path written = new ReportWriter(appConfig.reportsDir()).writeStressTest(runs);
        System.out.printf("Stress test: %d profiled runs -> %s%n", runs.size(), written);
        return RunOutcome.ok();
    }

    private RunOutcome benchmark() throws BatchFatalException, IOException {
        final BenchmarkConfig bench = appConfig.benchmark();
        final BenchmarkHarness harness = createHarness(bench);
        final List<BenchmarkRecord> records = harness.compare(bench.variantSpecs(), bench.iterations());
        final List<BenchmarkAggregate> aggregates = BenchmarkHarness.aggregate(records);
        printAggregates("comparison", aggregates);
        new ReportWriter(appConfig.reportsDir()).writeBenchmark("comparison", records, aggregates);
        return RunOutcome.ok();
    }

    private RunOutcome scenarios() throws BatchFatalException, IOException {
        final BenchmarkConfig bench = appConfig.benchmark();
        final Map<String, List<BenchmarkRecord>> byScenario = createHarness(bench)
                .runScenarios(BenchmarkScenario.defaultSeries(), appConfig.transformSpec(), bench.iterations());
        final ReportWriter writer = new ReportWriter(appConfig.reportsDir());
        for (Map.Entry<String, List<BenchmarkRecord>> entry : byScenario.entrySet()) {
            final List<BenchmarkAggregate> aggregates = BenchmarkHarness.aggregate(entry.getValue());
            printAggregates(entry.getKey(), aggregates);
            writer.writeBenchmark(entry.getKey(), entry.getValue(), aggregates);
        }
        return RunOutcome.ok();
    }

    private BenchmarkHarness createHarness(final BenchmarkConfig bench) {
        final BenchmarkHarness.InputProvider inputs = BenchmarkHarness.InputProvider.generated(
                bench.workDir().resolve("input"), bench.imageCount(), bench.imageWidth(), bench.imageHeight());
        return new BenchmarkHarness(new SequentialMultipassPipeline(),
                new ParallelSinglepassPipeline(appConfig.maxWorkers()), inputs, bench.workDir());
    }

    // --- Summary Printing ---
    static void printSummary(final BatchSummary summary) {
        System.out.println("---------------------- BATCH SUMMARY ----------------------");
        System.out.printf("Strategy: %-10s | Files: %d | Success: %d | Failed: %d | Total: %5dms | Avg/file: %5dms%n",
                summary.strategy(), summary.fileCount(), summary.successCount(), summary.failureCount(),
                summary.totalElapsed().toMillis(), summary.averagePerFile().toMillis());
        for (final ProcessingResult r : summary.results()) {
            final String failInfo = r.succeeded() ? "" : "[%s: %s]".formatted(r.errorKind(), r.errorMessage());
            System.out.printf("  File: %-40s | Status: %-7s | Duration: %5dms | Thread: %-16s %s%n",
                    r.fileName(), r.status(), r.elapsed().toMillis(), r.threadName(), failInfo);
        }
        System.out.println("------------------------------------------------------------");
    }

    private static void printAggregates(final String name, final List<BenchmarkAggregate> aggregates) {
        System.out.println("---------------------- BENCHMARK " + name + " ----------------------");
        for (final BenchmarkAggregate a : aggregates) {
            System.out.printf("Variant %d (%s) | %-10s | runs: %d | time: %7.2fs | cpu: %7.2fs | memory: %8.2fMB | ok: %.1f | failed: %.1f%n",
                    a.variantIndex(), a.variant().resizeDimensions(), a.strategy(), a.iterations(),
                    a.meanWallSeconds(), a.meanCpuSeconds(), a.meanMemoryMegabytes(),
                    a.meanSuccessCount(), a.meanFailureCount());
        }
        aggregates.stream().mapToInt(BenchmarkAggregate::variantIndex).distinct().forEach(v ->
                System.out.printf("Variant %d speedup (sequential / parallel): %.2fx%n", v,
                        BenchmarkHarness.speedup(aggregates, v)));
    }
}
