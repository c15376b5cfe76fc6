package org.pixelforge.util;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Utility methods for handling executors and futures.
 */
public final class ConcurrencyUtils {

    private static final Logger LOGGER = Logger.getLogger(ConcurrencyUtils.class.getName());
    private static final Duration SHUTDOWN_WAIT_TIMEOUT = Duration.ofSeconds(60);

    private ConcurrencyUtils() {
    } // Prevent instantiation

    /**
     * Creates a ThreadFactory for named, non-daemon platform threads: prefix + sequence number.
     */
    public static ThreadFactory createPlatformThreadFactory(final String prefix) {
        final AtomicInteger counter = new AtomicInteger(1);
        return runnable -> {
            final Thread thread = new Thread(runnable, prefix + counter.getAndIncrement());
            thread.setDaemon(false);
            return thread;
        };
    }

    /**
     * Gracefully shuts down an ExecutorService, forcing it after the wait timeout.
     */
    public static void shutdownExecutorService(final ExecutorService executor, final String name) {
        if (executor == null) return;
        LOGGER.fine(() -> "Attempting graceful shutdown of executor: " + name);

        executor.shutdown(); // Disable new tasks
        try {
            if (!executor.awaitTermination(SHUTDOWN_WAIT_TIMEOUT.toSeconds(), TimeUnit.SECONDS)) {
                LOGGER.warning(() -> "Executor %s did not terminate in %ds, forcing shutdown".formatted(name, SHUTDOWN_WAIT_TIMEOUT.toSeconds()));
                final List<Runnable> droppedTasks = executor.shutdownNow();
                LOGGER.warning(() -> "Executor %s dropped %d waiting tasks".formatted(name, droppedTasks.size()));

                if (!executor.awaitTermination(SHUTDOWN_WAIT_TIMEOUT.toSeconds(), TimeUnit.SECONDS))
                    LOGGER.severe(() -> "Executor " + name + " did not terminate even after forcing.");
            } else
                LOGGER.fine(() -> "Executor " + name + " terminated gracefully.");

        } catch (final InterruptedException ie) {
            LOGGER.warning(() -> "Shutdown wait for executor " + name + " interrupted. Forcing shutdown now.");
            executor.shutdownNow();
            Thread.currentThread().interrupt(); // Preserve interrupt status
        }
    }

    /**
     * Waits for all futures, then collects their results in submission order.
     * Futures that completed exceptionally or were cancelled are logged and left out.
     */
    public static <T> List<T> waitForCompletableFuturesAndCollect(
            final String levelName,
            final List<CompletableFuture<T>> futures,
            final Object identifier) {

        final String idStr = identifier != null ? identifier.toString() : "N/A";
        if (futures.isEmpty()) {
            LOGGER.fine(() -> "No %s job to wait for (ID: %s).".formatted(levelName, idStr));
            return Collections.emptyList();
        }

        LOGGER.fine(() -> "Waiting for %d %s jobs (ID: %s)".formatted(futures.size(), levelName, idStr));
        final CompletableFuture<Void> allOf = CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]));
        try {
            allOf.join();
        } catch (final CancellationException e) {
            LOGGER.warning(() -> "%s waiting (allOf) was cancelled (ID: %s).".formatted(levelName, idStr));
        } catch (final CompletionException e) {
            LOGGER.fine(() -> "%s jobs (ID: %s) finished with at least one failure: %s".formatted(levelName, idStr, e.getMessage()));
        }

        final List<T> results = new ArrayList<>(futures.size());
        for (final CompletableFuture<T> future : futures) {
            try {
                results.add(future.join());
            } catch (final CompletionException e) {
                final Throwable cause = e.getCause() != null ? e.getCause() : e;
                LOGGER.log(Level.WARNING, "%s job (ID: %s) completed exceptionally: %s".formatted(levelName, idStr, cause.getMessage()), cause);
            } catch (final CancellationException e) {
                LOGGER.warning(() -> "%s job (ID: %s) was cancelled.".formatted(levelName, idStr));
            }
        }

        LOGGER.fine(() -> "Finished waiting for %s (ID: %s). Collected %d results (out of %d submitted)."
                .formatted(levelName, idStr, results.size(), futures.size()));
        return results; // May be partial
    }
}
