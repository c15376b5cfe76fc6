package org.pixelforge.processing;

import org.pixelforge.metrics.ErrorKind;
import org.pixelforge.metrics.ProcessingResult;
import org.pixelforge.metrics.StatusHelper;
import org.pixelforge.util.ConcurrencyUtils;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fans a batch of files out over a fixed pool of platform threads, one task per file.
 * <p>
 * Every submitted file yields exactly one {@link ProcessingResult}: a worker that throws is
 * recorded as a failed result for its file and the other tasks keep running. {@link #run}
 * returns once all tasks are done, with results in submission order.
 */
public class WorkerPool {

    public static final int DEFAULT_MAX_WORKERS = 4;
    static final String THREAD_PREFIX = "ImageWorker-";

    /**
     * Work applied to one file.
     */
    @FunctionalInterface
    public interface FileWorker {
        ProcessingResult process(Path file) throws Exception;
    }

    private final Logger logger;

    public WorkerPool() {
        this(Logger.getLogger(WorkerPool.class.getName()));
    }

    public WorkerPool(final Logger logger) {
        this.logger = logger;
    }

    public List<ProcessingResult> run(final List<Path> files, final FileWorker worker) {
        return run(files, worker, DEFAULT_MAX_WORKERS);
    }

    /**
     * @throws IllegalArgumentException if {@code maxWorkers} is not positive or two files share a name
     */
    public List<ProcessingResult> run(final List<Path> files, final FileWorker worker, final int maxWorkers) {
        if (maxWorkers <= 0) throw new IllegalArgumentException("maxWorkers must be > 0, got " + maxWorkers);
        rejectDuplicateNames(files);
        if (files.isEmpty()) return List.of();

        final int poolSize = Math.min(maxWorkers, files.size());
        final ThreadFactory factory = ConcurrencyUtils.createPlatformThreadFactory(THREAD_PREFIX);
        final ExecutorService executor = Executors.newFixedThreadPool(poolSize, factory);
        final List<CompletableFuture<ProcessingResult>> futures = new ArrayList<>(files.size());
        logger.fine(() -> "Submitting %d files to %d workers".formatted(files.size(), poolSize));

        try {
            for (final Path file : files) {
                final String fileName = file.getFileName().toString();
                final CompletableFuture<ProcessingResult> future = CompletableFuture.supplyAsync(() -> {
                    try {
                        return worker.process(file);
                    } catch (final RuntimeException e) {
                        throw e;
                    } catch (final Exception e) {
                        throw new CompletionException(e);
                    }
                }, executor).exceptionally(ex -> {
                    final Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
                    logger.log(Level.WARNING, "Worker failed on %s: %s".formatted(fileName, cause), cause);
                    return StatusHelper.createFailedResult(fileName, kindOf(cause), cause);
                });
                futures.add(future);
            }
            return ConcurrencyUtils.waitForCompletableFuturesAndCollect("ImageTask", futures, poolSize + " workers");
        } finally {
            ConcurrencyUtils.shutdownExecutorService(executor, "WorkerPool");
        }
    }

    private static ErrorKind kindOf(final Throwable cause) {
        return cause instanceof ImageProcessingException processing ? processing.kind() : ErrorKind.UNEXPECTED;
    }

    private static void rejectDuplicateNames(final List<Path> files) {
        final Set<String> names = new HashSet<>();
        for (Path file : files) {
            final String name = file.getFileName().toString();
            if (!names.add(name)) throw new IllegalArgumentException("Duplicate file name in batch: " + name);
        }
    }
}
