package org.pixelforge.processing;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.pixelforge.config.TransformSpec;
import org.pixelforge.metrics.*;
import org.pixelforge.util.FileUtils;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BenchmarkHarnessTest {

    private static final TransformSpec SMALL = TransformSpec.of(16, 12, 0.0, 1.0, 1.0, 1.0);
    private static final TransformSpec OTHER = TransformSpec.of(8, 8, 1.0, 1.5, 1.2, 1.1);

    @TempDir
    Path tempDir;

    @Mock
    private ImagePipeline mockSequential;
    @Mock
    private ImagePipeline mockParallel;

    private Path inputDir;

    @BeforeEach
    void setUp() throws Exception {
        inputDir = Files.createDirectories(tempDir.resolve("input"));
    }

    private static BatchSummary summary(final Strategy strategy, final int ok, final int failed) {
        List<ProcessingResult> results = new ArrayList<>();
        for (int i = 0; i < ok; i++)
            results.add(StatusHelper.createSuccessResult("ok_" + i + ".png", Duration.ofMillis(5), 0L));
        for (int i = 0; i < failed; i++)
            results.add(StatusHelper.createFailedResult("bad_" + i + ".png", ErrorKind.DECODE,
                    new DecodeException("corrupt"), Duration.ofMillis(1), 0L));
        return BatchSummary.of(strategy, results, Duration.ofMillis(10));
    }

    private void stubPipelines() throws Exception {
        when(mockSequential.strategy()).thenReturn(Strategy.SEQUENTIAL);
        when(mockParallel.strategy()).thenReturn(Strategy.PARALLEL);
        when(mockSequential.process(any(), any(), any())).thenReturn(summary(Strategy.SEQUENTIAL, 2, 1));
        when(mockParallel.process(any(), any(), any())).thenReturn(summary(Strategy.PARALLEL, 2, 1));
    }

    private static BenchmarkRecord record(final int variant, final Strategy strategy, final long wallMillis,
                                          final long memoryBytes, final int ok) {
        return new BenchmarkRecord(variant, SMALL, 0, strategy, summary(strategy, ok, 0),
                new ResourceDelta(wallMillis * 1_000_000L, wallMillis * 500_000L, memoryBytes));
    }

    @Test
    void testCompare_recordCountAndOrder() throws Exception {
        stubPipelines();
        BenchmarkHarness harness = new BenchmarkHarness(mockSequential, mockParallel,
                BenchmarkHarness.InputProvider.provided(inputDir), tempDir.resolve("work"));

        List<BenchmarkRecord> records = harness.compare(List.of(SMALL, OTHER), 3);

        assertEquals(12, records.size(), "2 strategies x 2 variants x 3 iterations");
        assertEquals(Strategy.SEQUENTIAL, records.get(0).strategy());
        assertEquals(Strategy.PARALLEL, records.get(1).strategy());
        assertEquals(0, records.get(1).iteration());
        assertEquals(1, records.get(2).iteration());
        assertEquals(1, records.get(6).variantIndex());
        assertSame(OTHER, records.get(11).variant());
        assertEquals(2, records.get(5).summary().successCount());
        verify(mockSequential, times(6)).process(eq(inputDir), any(), any());
        verify(mockParallel, times(6)).process(eq(inputDir), any(), any());
    }

    @Test
    void testCompare_outputDirectoryEmptyBeforeEveryRun() throws Exception {
        when(mockSequential.strategy()).thenReturn(Strategy.SEQUENTIAL);
        when(mockParallel.strategy()).thenReturn(Strategy.PARALLEL);
        List<Path> seenOutputs = new ArrayList<>();
        for (ImagePipeline pipeline : List.of(mockSequential, mockParallel)) {
            doAnswer(invocation -> {
                Path out = invocation.getArgument(1);
                assertTrue(FileUtils.isEmptyDirectory(out), "Output directory must be fresh: " + out);
                Files.writeString(out.resolve("processed_left_behind.png"), "stale");
                seenOutputs.add(out);
                return summary(pipeline.strategy(), 1, 0);
            }).when(pipeline).process(any(), any(), any());
        }
        BenchmarkHarness harness = new BenchmarkHarness(mockSequential, mockParallel,
                BenchmarkHarness.InputProvider.provided(inputDir), tempDir.resolve("work"));

        harness.compare(List.of(SMALL), 2);

        assertEquals(4, seenOutputs.size());
        assertEquals(tempDir.resolve("work/output/sequential"), seenOutputs.get(0));
        assertEquals(tempDir.resolve("work/output/parallel"), seenOutputs.get(1));
    }

    @Test
    void testCompare_rejectsNonPositiveIterations() {
        BenchmarkHarness harness = new BenchmarkHarness(mockSequential, mockParallel,
                BenchmarkHarness.InputProvider.provided(inputDir), tempDir.resolve("work"));

        assertThrows(IllegalArgumentException.class, () -> harness.compare(List.of(SMALL), 0));
        verifyNoInteractions(mockSequential, mockParallel);
    }

    @Test
    void testCompare_missingInputsAreFatal() {
        BenchmarkHarness harness = new BenchmarkHarness(mockSequential, mockParallel,
                BenchmarkHarness.InputProvider.provided(tempDir.resolve("absent")), tempDir.resolve("work"));

        assertThrows(BatchFatalException.class, () -> harness.compare(List.of(SMALL), 1));
    }

    @Test
    void testCompare_pipelineFatalPropagates() throws Exception {
        when(mockSequential.strategy()).thenReturn(Strategy.SEQUENTIAL);
        when(mockSequential.process(any(), any(), any())).thenThrow(new BatchFatalException("input vanished"));
        BenchmarkHarness harness = new BenchmarkHarness(mockSequential, mockParallel,
                BenchmarkHarness.InputProvider.provided(inputDir), tempDir.resolve("work"));

        BatchFatalException e = assertThrows(BatchFatalException.class, () -> harness.compare(List.of(SMALL), 1));
        assertEquals("input vanished", e.getMessage());
        verify(mockParallel, never()).process(any(), any(), any());
    }

    @Test
    void testAggregate_meansPerVariantAndStrategy() {
        List<BenchmarkRecord> records = List.of(
                record(1, Strategy.PARALLEL, 100, 0L, 4),
                record(0, Strategy.SEQUENTIAL, 400, 2L * 1024 * 1024, 4),
                record(0, Strategy.PARALLEL, 100, 0L, 4),
                record(0, Strategy.SEQUENTIAL, 600, 0L, 2),
                record(0, Strategy.PARALLEL, 300, 0L, 4));

        List<BenchmarkAggregate> aggregates = BenchmarkHarness.aggregate(records);

        assertEquals(3, aggregates.size());
        BenchmarkAggregate seq = aggregates.get(0);
        assertEquals(0, seq.variantIndex());
        assertEquals(Strategy.SEQUENTIAL, seq.strategy());
        assertEquals(2, seq.iterations());
        assertEquals(0.5, seq.meanWallSeconds(), 1e-9);
        assertEquals(0.25, seq.meanCpuSeconds(), 1e-9);
        assertEquals(1.0, seq.meanMemoryMegabytes(), 1e-9);
        assertEquals(3.0, seq.meanSuccessCount(), 1e-9);
        assertEquals(Strategy.PARALLEL, aggregates.get(1).strategy());
        assertEquals(0.2, aggregates.get(1).meanWallSeconds(), 1e-9);
        assertEquals(1, aggregates.get(2).variantIndex());
        assertEquals(5, records.size(), "Aggregation must not alter its input");
    }

    @Test
    void testSpeedup() {
        List<BenchmarkAggregate> aggregates = BenchmarkHarness.aggregate(List.of(
                record(0, Strategy.SEQUENTIAL, 900, 0L, 1),
                record(0, Strategy.PARALLEL, 300, 0L, 1),
                record(1, Strategy.SEQUENTIAL, 100, 0L, 1),
                record(1, Strategy.PARALLEL, 0, 0L, 1),
                record(2, Strategy.SEQUENTIAL, 100, 0L, 1)));

        assertEquals(3.0, BenchmarkHarness.speedup(aggregates, 0), 1e-9);
        assertTrue(Double.isNaN(BenchmarkHarness.speedup(aggregates, 1)), "Zero parallel time has no speedup");
        assertThrows(IllegalArgumentException.class, () -> BenchmarkHarness.speedup(aggregates, 2));
        assertThrows(IllegalArgumentException.class, () -> BenchmarkHarness.speedup(aggregates, 7));
    }

    @Test
    void testRunScenarios_keyedInOrderWithGeneratedInputs() throws Exception {
        stubPipelines();
        Path work = tempDir.resolve("work");
        BenchmarkHarness harness = new BenchmarkHarness(mockSequential, mockParallel,
                BenchmarkHarness.InputProvider.provided(inputDir), work);
        List<BenchmarkScenario> scenarios = List.of(
                new BenchmarkScenario("size_24x16", 2, 24, 16),
                new BenchmarkScenario("count_3", 3, 16, 16));

        Map<String, List<BenchmarkRecord>> byScenario = harness.runScenarios(scenarios, SMALL, 1);

        assertEquals(List.of("size_24x16", "count_3"), new ArrayList<>(byScenario.keySet()));
        assertEquals(2, byScenario.get("count_3").size());
        assertEquals(2, FileUtils.listFiles(work.resolve("input/size_24x16"), "glob:*.png").size());
        assertEquals(3, FileUtils.listFiles(work.resolve("input/count_3"), "glob:*.png").size());
        verify(mockParallel).process(eq(work.resolve("input/count_3")), eq(work.resolve("output/count_3/parallel")), eq(SMALL));
    }

    @Test
    void testRunScenarios_rejectsDuplicateNames() {
        BenchmarkHarness harness = new BenchmarkHarness(mockSequential, mockParallel,
                BenchmarkHarness.InputProvider.provided(inputDir), tempDir.resolve("work"));
        BenchmarkScenario tiny = new BenchmarkScenario("tiny", 1, 8, 8);

        assertThrows(IllegalArgumentException.class, () -> harness.runScenarios(List.of(tiny, tiny), SMALL, 1));
    }

    @Test
    void testDefaultSeries() {
        List<BenchmarkScenario> series = BenchmarkScenario.defaultSeries();

        assertEquals(7, series.size());
        assertEquals(new BenchmarkScenario("count_10", 10, 1920, 1080), series.get(1));
        assertEquals(new BenchmarkScenario("size_3840x2160", 5, 3840, 2160), series.get(6));
    }

    @Test
    @Timeout(value = 60, unit = TimeUnit.SECONDS)
    void testCompare_realPipelinesOnGeneratedImages() throws Exception {
        Path work = tempDir.resolve("work");
        BenchmarkHarness harness = new BenchmarkHarness(new SequentialMultipassPipeline(),
                new ParallelSinglepassPipeline(2),
                BenchmarkHarness.InputProvider.generated(work.resolve("input"), 3, 48, 32), work);

        List<BenchmarkRecord> records = harness.compare(List.of(SMALL), 1);
        List<BenchmarkAggregate> aggregates = BenchmarkHarness.aggregate(records);

        assertEquals(2, records.size());
        for (BenchmarkRecord r : records) {
            assertEquals(3, r.summary().successCount(), "Generated inputs are all valid for " + r.strategy());
            assertTrue(r.resources().wallNanos() > 0);
        }
        assertEquals(3, FileUtils.listFiles(work.resolve("output/parallel"), "glob:processed_*.png").size());
        assertEquals(2, aggregates.size());
    }
}
