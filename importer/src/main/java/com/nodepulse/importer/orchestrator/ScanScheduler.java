package com.nodepulse.importer.orchestrator;

import com.nodepulse.importer.scanner.FileSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Drives passes of the {@link WorkerPool} over a {@link FileSource}.
 *
 * <p>With a non-positive interval a single pass is run. Otherwise passes
 * start {@code interval} apart: after each pass the scheduler sleeps for
 * the interval minus the time the pass took, or not at all when the pass
 * overran. A pass always runs to completion; {@link #stop()} takes effect
 * between passes and cuts a pending sleep short.</p>
 */
public class ScanScheduler {

    private static final Logger logger = LoggerFactory.getLogger(ScanScheduler.class);

    /**
     * Waits between passes. Returns early when the scheduler is stopped.
     */
    @FunctionalInterface
    interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final WorkerPool pool;
    private final FileSource source;
    private final Duration interval;
    private final Clock clock;
    private final Sleeper sleeper;
    private final CountDownLatch stopSignal = new CountDownLatch(1);

    public ScanScheduler(WorkerPool pool, FileSource source, Duration interval) {
        this.pool = pool;
        this.source = source;
        this.interval = interval;
        this.clock = Clock.systemUTC();
        this.sleeper = d -> stopSignal.await(d.toMillis(), TimeUnit.MILLISECONDS);
    }

    // Visible for testing
    ScanScheduler(WorkerPool pool, FileSource source, Duration interval, Clock clock, Sleeper sleeper) {
        this.pool = pool;
        this.source = source;
        this.interval = interval;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    public boolean isRepeating() {
        return !interval.isNegative() && !interval.isZero();
    }

    /**
     * Runs passes until a single pass is done or {@link #stop()} is called.
     *
     * @return the result of the last pass
     * @throws InterruptedException if interrupted while sleeping between passes
     */
    public ScanResult run() throws InterruptedException {
        ScanResult last;
        do {
            Instant passStart = clock.instant();
            logger.info("Start parsing files");
            last = pool.run(source);
            Duration elapsed = Duration.between(passStart, clock.instant());

            if (!isRepeating()) {
                logPass(last, elapsed, null);
                break;
            }

            Duration wait = waitAfter(interval, elapsed);
            logPass(last, elapsed, wait);
            if (isStopped()) {
                break;
            }
            sleeper.sleep(wait);
        } while (!isStopped());
        return last;
    }

    /** Asks the scheduler to return after the current pass. */
    public void stop() {
        stopSignal.countDown();
    }

    public boolean isStopped() {
        return stopSignal.getCount() == 0;
    }

    /**
     * Sleep owed after a pass that took {@code elapsed}: {@code max(0, interval - elapsed)}.
     */
    static Duration waitAfter(Duration interval, Duration elapsed) {
        Duration wait = interval.minus(elapsed);
        return wait.isNegative() ? Duration.ZERO : wait;
    }

    private static void logPass(ScanResult result, Duration elapsed, Duration wait) {
        String next = wait == null ? "single pass, not repeating" : "waiting " + wait.toMillis() + " ms before next run";
        logger.info("Parsing {} files and doing {} inserts took {} ms, {} files failed; {}",
                result.filesScanned(), result.recordsCommitted(), elapsed.toMillis(), result.filesFailed(), next);
        if (result.hasFailures()) {
            result.outcomes().stream()
                    .filter(FileOutcome::committedButNotRelocated)
                    .forEach(o -> logger.warn("  COMMITTED_NOT_RELOCATED: {} ({} records)",
                            o.file(), o.recordsCommitted()));
        }
    }
}
