package org.pixelforge.metrics;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.logging.Logger;

/**
 * Writes reports as indented JSON into the reports directory. File names carry a
 * {@code yyyyMMdd_HHmmss} stamp; durations are written as ISO-8601 strings.
 */
public class ReportWriter {
    private static final Logger LOGGER = Logger.getLogger(ReportWriter.class.getName());

    static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final Path reportsDir;
    private final Clock clock;
    private final ObjectMapper mapper;

    public ReportWriter(final Path reportsDir) {
        this(reportsDir, Clock.systemDefaultZone());
    }

    public ReportWriter(final Path reportsDir, final Clock clock) {
        this.reportsDir = reportsDir;
        this.clock = clock;
        this.mapper = jsonMapper();
    }

    public Path writeProfile(final ProfileReport report) throws IOException {
        return write("profile_data_" + stamp() + ".json", report);
    }

    public Path writeStressTest(final List<StressRun> runs) throws IOException {
        return write("stress_test_" + stamp() + ".json", runs);
    }

    public Path writeBenchmark(final String name, final List<BenchmarkRecord> records,
                               final List<BenchmarkAggregate> aggregates) throws IOException {
        final String stamp = stamp();
        final BenchmarkSession session = new BenchmarkSession(name, stamp, records, aggregates);
        return write("benchmark_" + name + "_" + stamp + ".json", session);
    }

    private Path write(final String fileName, final Object value) throws IOException {
        Files.createDirectories(reportsDir);
        final Path target = reportsDir.resolve(fileName);
        mapper.writeValue(target.toFile(), value);
        LOGGER.info(() -> "Report written to " + target.toAbsolutePath());
        return target;
    }

    private String stamp() {
        return LocalDateTime.now(clock).format(FILE_STAMP);
    }

    static ObjectMapper jsonMapper() {
        final ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        mapper.disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS);
        return mapper;
    }
}
