package com.nodepulse.importer.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Utility methods for creating and shutting down executors.
 */
public final class ConcurrencyUtils {

    private static final Logger logger = LoggerFactory.getLogger(ConcurrencyUtils.class);

    private static final Duration SHUTDOWN_WAIT_TIMEOUT = Duration.ofSeconds(60);

    private ConcurrencyUtils() {
    }

    /**
     * Creates a factory for platform threads named {@code prefix0}, {@code prefix1}, ...
     */
    public static ThreadFactory createPlatformThreadFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.getAndIncrement());
            thread.setDaemon(false);
            return thread;
        };
    }

    /**
     * Gracefully shuts down an executor, forcing it after a timeout.
     */
    public static void shutdownExecutorService(ExecutorService executor, String name) {
        if (executor == null) return;
        executor.shutdown();
        try {
            if (!executor.awaitTermination(SHUTDOWN_WAIT_TIMEOUT.toSeconds(), TimeUnit.SECONDS)) {
                logger.warn("Executor {} did not terminate in {}s, forcing shutdown", name,
                        SHUTDOWN_WAIT_TIMEOUT.toSeconds());
                List<Runnable> dropped = executor.shutdownNow();
                logger.warn("Executor {} dropped {} waiting tasks", name, dropped.size());
                if (!executor.awaitTermination(SHUTDOWN_WAIT_TIMEOUT.toSeconds(), TimeUnit.SECONDS)) {
                    logger.error("Executor {} did not terminate even after forcing", name);
                }
            } else {
                logger.debug("Executor {} terminated gracefully", name);
            }
        } catch (InterruptedException e) {
            logger.warn("Shutdown wait for executor {} interrupted, forcing shutdown now", name);
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
