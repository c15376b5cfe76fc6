package org.pixelforge.util;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * File system helpers for listing inputs and resetting working directories.
 */
public final class FileUtils {

    private FileUtils() {
    }

    /**
     * Regular files directly inside {@code sourceDir} accepted by the matcher, sorted by name.
     *
     * @throws IOException if {@code sourceDir} is not a readable directory
     */
    public static List<Path> listFiles(final Path sourceDir, final PathMatcher fileMatcher) throws IOException {
        if (!Files.isDirectory(sourceDir)) throw new IOException("Dir not found: " + sourceDir);
        final PathMatcher matcher = fileMatcher != null ? fileMatcher : path -> true;
        try (Stream<Path> stream = Files.list(sourceDir)) {
            return stream.filter(Files::isRegularFile)
                    .filter(p -> matcher.matches(p.getFileName()))
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .toList();
        }
    }

    /**
     * Same as {@link #listFiles(Path, PathMatcher)} with a glob or regex pattern such as {@code glob:*.png}.
     */
    public static List<Path> listFiles(final Path sourceDir, final String fileFilter) throws IOException {
        final PathMatcher matcher = (fileFilter != null && !fileFilter.isBlank())
                ? FileSystems.getDefault().getPathMatcher(fileFilter) : null;
        return listFiles(sourceDir, matcher);
    }

    public static boolean isEmptyDirectory(final Path dir) throws IOException {
        try (Stream<Path> entries = Files.list(dir)) {
            return entries.findAny().isEmpty();
        }
    }

    /**
     * Deletes {@code dir} with everything below it, then creates it again empty.
     */
    public static Path recreateDirectory(final Path dir) throws IOException {
        deleteRecursively(dir);
        return Files.createDirectories(dir);
    }

    public static void deleteRecursively(final Path root) throws IOException {
        if (!Files.exists(root)) return;
        try (Stream<Path> walk = Files.walk(root)) {
            final List<Path> paths = walk.sorted(Comparator.reverseOrder()).toList();
            for (Path p : paths) Files.delete(p);
        }
    }
}
