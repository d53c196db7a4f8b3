package com.nodepulse.importer.orchestrator;

import com.nodepulse.importer.error.FailureKind;
import com.nodepulse.importer.scanner.FileSource;
import com.nodepulse.importer.util.ConcurrencyUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Runs the {@link FileProcessor} over every file of a pass with at most
 * {@code concurrency} files in flight.
 *
 * <p>Files are submitted while the source is still being walked. Each
 * file yields exactly one {@link FileOutcome}: a task that throws is
 * converted into a failed outcome, and never affects the other tasks.
 * Outcomes are returned in submission order, which says nothing about
 * completion order.</p>
 */
public class WorkerPool {

    private static final Logger logger = LoggerFactory.getLogger(WorkerPool.class);

    private final FileProcessor processor;
    private final int concurrency;

    public WorkerPool(FileProcessor processor, int concurrency) {
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be at least 1, was " + concurrency);
        }
        this.processor = processor;
        this.concurrency = concurrency;
    }

    /**
     * Processes every file {@code source} yields and waits for all of them.
     */
    public ScanResult run(FileSource source) {
        long start = System.currentTimeMillis();
        ExecutorService executor = Executors.newFixedThreadPool(concurrency,
                ConcurrencyUtils.createPlatformThreadFactory("import-worker-"));

        List<PendingFile> pending = new ArrayList<>();
        try {
            try {
                source.forEachFile(file -> pending.add(new PendingFile(file,
                        CompletableFuture.supplyAsync(() -> processor.process(file), executor)
                                .exceptionally(t -> crashed(file, t)))));
            } catch (IOException e) {
                logger.error("Directory walk aborted after {} files: {}", pending.size(), e.toString());
            }

            List<FileOutcome> outcomes = new ArrayList<>(pending.size());
            for (PendingFile p : pending) {
                outcomes.add(await(p));
            }
            return new ScanResult(outcomes, System.currentTimeMillis() - start);
        } finally {
            ConcurrencyUtils.shutdownExecutorService(executor, "import-workers");
        }
    }

    private static FileOutcome await(PendingFile p) {
        try {
            return p.future().join();
        } catch (CancellationException e) {
            return crashed(p.file(), e);
        }
    }

    private static FileOutcome crashed(Path file, Throwable t) {
        Throwable cause = t.getCause() != null ? t.getCause() : t;
        logger.error("{}: worker failed on file {}", FailureKind.INTERNAL_ERROR, file, cause);
        return FileOutcome.failed(file, FailureKind.INTERNAL_ERROR, cause.toString(), null, 0);
    }

    private record PendingFile(Path file, CompletableFuture<FileOutcome> future) {}
}
