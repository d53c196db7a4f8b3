package com.nodepulse.importer.orchestrator;

import com.nodepulse.importer.batch.BatchBuilder;
import com.nodepulse.importer.config.AppConfig;
import com.nodepulse.importer.config.ImporterOptions;
import com.nodepulse.importer.parser.RecordParser;
import com.nodepulse.importer.scanner.DirectoryScanner;
import com.nodepulse.importer.sink.BigQueryBatchSink;
import com.nodepulse.importer.validation.MeasurementValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Main entry point for the NodePulse measurement importer.
 * Parses CLI arguments, opens the sink once, and runs the scan scheduler
 * until a single pass finishes or the process is told to stop.
 *
 * <p>Usage:
 * <pre>
 *   java -jar importer.jar -k measurements --authenv -I /indir -i 60 -c 4
 *   java -jar importer.jar -k measurements --debug          # dry run
 * </pre>
 */
public class ImporterApp {

    private static final Logger logger = LoggerFactory.getLogger(ImporterApp.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    /** How long a shutdown waits for the running pass to finish. */
    static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(60);

    public static void main(String[] args) {
        ImporterOptions options;
        try {
            options = ImporterOptions.parse(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println(ImporterOptions.usage());
            System.exit(EXIT_USAGE);
            return;
        }
        if (options.isHelp()) {
            System.out.println(ImporterOptions.usage());
            System.exit(EXIT_OK);
        }

        System.exit(run(options));
    }

    static int run(ImporterOptions options) {
        logger.info("Starting NodePulse Importer ({})", options);

        List<Path> missing = missingDirectories(options);
        if (!missing.isEmpty()) {
            logger.error("Directories must exist before start, missing: {}", missing);
            return EXIT_FAILURE;
        }

        BigQueryBatchSink sink = null;
        CountDownLatch exited = new CountDownLatch(1);
        try {
            if (options.isDebug()) {
                System.out.println("Debug mode: will not insert any records or move any files");
                System.out.println("Info and statements are printed to stdout");
            } else {
                AppConfig environment = options.isAuthEnv() ? new AppConfig() : null;
                String projectId = options.resolveProjectId(environment);
                String credentials = options.resolveCredentialsFile(environment);
                sink = new BigQueryBatchSink(projectId, options.getDataset(), credentials);
                sink.verifyDataset();
            }

            FileProcessor processor = new FileProcessor(
                    new RecordParser(),
                    new BatchBuilder(),
                    options.isValidate() ? new MeasurementValidator() : null,
                    sink,
                    new FileRelocator(options.getFailedDir(), options.getProcessedDir()),
                    options.getVerbosity());
            WorkerPool pool = new WorkerPool(processor, options.getConcurrency());
            DirectoryScanner scanner = new DirectoryScanner(options.getInputDir(),
                    List.of(options.getFailedDir(), options.getProcessedDir()));
            ScanScheduler scheduler = new ScanScheduler(pool, scanner, options.getInterval());

            Runtime.getRuntime().addShutdownHook(shutdownHook(scheduler, exited, SHUTDOWN_GRACE));

            ScanResult last = scheduler.run();
            logger.info("NodePulse Importer finished ({} files failed in last pass)", last.filesFailed());
            return EXIT_OK;

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted, stopping");
            return EXIT_FAILURE;
        } catch (Exception e) {
            logger.error("Fatal error during import", e);
            return EXIT_FAILURE;
        } finally {
            if (sink != null) {
                sink.close();
            }
            exited.countDown();
        }
    }

    /**
     * Hook that stops the scheduler and then holds the JVM open until the
     * current pass has finished and the sink is closed, or {@code grace} ran out.
     */
    static Thread shutdownHook(ScanScheduler scheduler, CountDownLatch exited, Duration grace) {
        return new Thread(() -> {
            logger.info("Shutdown requested, finishing the current pass");
            scheduler.stop();
            try {
                if (!exited.await(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                    logger.warn("Import did not finish within {} s, exiting anyway", grace.toSeconds());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warn("Interrupted while waiting for the import to finish");
            }
        }, "importer-shutdown");
    }

    static List<Path> missingDirectories(ImporterOptions options) {
        return List.of(options.getInputDir(), options.getFailedDir(), options.getProcessedDir()).stream()
                .filter(dir -> !Files.isDirectory(dir))
                .toList();
    }
}
