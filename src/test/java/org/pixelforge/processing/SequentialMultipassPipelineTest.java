package org.pixelforge.processing;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.pixelforge.config.TransformSpec;
import org.pixelforge.metrics.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.logging.Logger;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class SequentialMultipassPipelineTest {

    private static final TransformSpec SMALL = TransformSpec.of(32, 24, 1.0, 1.5, 1.2, 1.1);

    @TempDir
    Path tempDir;

    private final SequentialMultipassPipeline pipeline = new SequentialMultipassPipeline();

    private static List<String> listNames(final Path dir) throws IOException {
        try (Stream<Path> files = Files.list(dir)) {
            return files.map(p -> p.getFileName().toString()).sorted().toList();
        }
    }

    @Test
    void testProcess_corruptFileFailsAlone() throws Exception {
        Path input = PipelineFixtures.jpegsWithOneFake(tempDir.resolve("in"));
        Path output = tempDir.resolve("out");

        BatchSummary summary = pipeline.process(input, output, SMALL);

        assertEquals(Strategy.SEQUENTIAL, summary.strategy());
        assertEquals(3, summary.successCount());
        assertEquals(1, summary.failureCount());
        ProcessingResult fake = summary.results().stream().filter(r -> r.fileName().equals("fake.jpg")).findFirst().orElseThrow();
        assertEquals(Status.FAILED, fake.status());
        assertEquals(ErrorKind.DECODE, fake.errorKind());
        assertEquals(List.of("processed_one.jpg", "processed_three.jpg", "processed_two.jpg"), listNames(output),
                "Only successful files are written and no staging file is left behind.");
    }

    @Test
    void testProcess_rerunOverwritesPreviousOutputs() throws Exception {
        Path input = PipelineFixtures.jpegsWithOneFake(tempDir.resolve("in"));
        Path output = tempDir.resolve("out");

        pipeline.process(input, output, SMALL);
        BatchSummary second = pipeline.process(input, output, SMALL);

        assertEquals(3, second.successCount());
        assertEquals(3, listNames(output).size(), "A second run replaces outputs instead of adding to them.");
    }

    @Test
    void testProcess_outputMatchesSpecDimensions() throws Exception {
        Path input = PipelineFixtures.jpegsWithOneFake(tempDir.resolve("in"));
        Path output = tempDir.resolve("out");

        pipeline.process(input, output, SMALL);

        var decoded = new ImageCodec().decode(output.resolve("processed_two.jpg"));
        assertEquals(32, decoded.getWidth());
        assertEquals(24, decoded.getHeight());
    }

    @Test
    void testProcess_fiveRoundTripsPerFile() throws Exception {
        Path input = tempDir.resolve("in");
        Files.createDirectories(input);
        TestImages.write(TestImages.noise(20, 20, 1L), input.resolve("only.jpg"), "jpg");
        Path output = tempDir.resolve("out");
        ImageCodec codec = spy(new ImageCodec());
        SequentialMultipassPipeline spied = new SequentialMultipassPipeline(codec, new TransformChain(),
                new ResourceSampler(), Logger.getLogger("test"));

        spied.process(input, output, SMALL);

        verify(codec, times(5)).decode(any());
        verify(codec, times(4)).encode(any(), eq(SequentialMultipassPipeline.stagingPath(output.resolve("processed_only.jpg"))),
                eq(ImageFormat.PNG));
        verify(codec).encode(any(), eq(output.resolve("processed_only.jpg")), eq(ImageFormat.JPEG));
        assertFalse(Files.exists(SequentialMultipassPipeline.stagingPath(output.resolve("processed_only.jpg"))));
    }

    @Test
    void testProcess_unsupportedFilesIgnored() throws Exception {
        Path input = PipelineFixtures.jpegsWithOneFake(tempDir.resolve("in"));
        Files.writeString(input.resolve("notes.txt"), "not counted");
        Files.writeString(input.resolve("anim.gif"), "not counted");

        BatchSummary summary = pipeline.process(input, tempDir.resolve("out"), SMALL);

        assertEquals(4, summary.fileCount(), "Only supported extensions are part of the batch.");
    }

    @Test
    void testProcess_createsNestedOutputDirectory() throws Exception {
        Path input = PipelineFixtures.jpegsWithOneFake(tempDir.resolve("in"));
        Path output = tempDir.resolve("a/b/c");

        pipeline.process(input, output, SMALL);

        assertTrue(Files.isDirectory(output));
    }

    @Test
    void testProcess_invalidSpecFailsEveryFile() throws Exception {
        Path input = PipelineFixtures.jpegsWithOneFake(tempDir.resolve("in"));

        BatchSummary summary = pipeline.process(input, tempDir.resolve("out"), TransformSpec.of(32, 24, 1.0, -2.0, 1.0, 1.0));

        assertEquals(0, summary.successCount());
        assertEquals(4, summary.failureCount());
        assertEquals(3, summary.results().stream().filter(r -> r.errorKind() == ErrorKind.TRANSFORM).count());
    }

    @Test
    void testProcess_hugeBlurRadiusKeepsFilesIsolated() throws Exception {
        Path input = PipelineFixtures.jpegsWithOneFake(tempDir.resolve("in"));

        BatchSummary summary = pipeline.process(input, tempDir.resolve("out"), TransformSpec.of(8, 8, 1.0e8, 1, 1, 1));

        assertEquals(3, summary.successCount());
        assertEquals(1, summary.failureCount());
        assertEquals(ErrorKind.DECODE, summary.results().stream()
                .filter(r -> !r.succeeded()).findFirst().orElseThrow().errorKind());
    }

    @Test
    void testProcess_missingInputDirectoryIsFatal() {
        assertThrows(BatchFatalException.class,
                () -> pipeline.process(tempDir.resolve("absent"), tempDir.resolve("out"), SMALL));
    }

    @Test
    void testProcess_inputIsAFileIsFatal() throws IOException {
        Path file = Files.writeString(tempDir.resolve("file.jpg"), "x");

        assertThrows(BatchFatalException.class, () -> pipeline.process(file, tempDir.resolve("out"), SMALL));
    }

    @Test
    void testProcess_emptyInputDirectoryIsFatal() throws IOException {
        Path empty = Files.createDirectories(tempDir.resolve("empty"));

        BatchFatalException e = assertThrows(BatchFatalException.class,
                () -> pipeline.process(empty, tempDir.resolve("out"), SMALL));
        assertTrue(e.getMessage().contains("empty"));
    }

    @Test
    void testProcess_onlyUnsupportedFilesGivesEmptySummary() throws Exception {
        Path input = Files.createDirectories(tempDir.resolve("in"));
        Files.writeString(input.resolve("readme.md"), "nothing to see");

        BatchSummary summary = pipeline.process(input, tempDir.resolve("out"), SMALL);

        assertEquals(0, summary.fileCount());
        assertTrue(summary.results().isEmpty());
    }

    @Test
    void testProcess_uncreatableOutputDirectoryIsFatal() throws Exception {
        Path input = PipelineFixtures.jpegsWithOneFake(tempDir.resolve("in"));
        Path blocker = Files.writeString(tempDir.resolve("blocker"), "a file, not a directory");

        assertThrows(BatchFatalException.class, () -> pipeline.process(input, blocker.resolve("out"), SMALL));
    }
}
