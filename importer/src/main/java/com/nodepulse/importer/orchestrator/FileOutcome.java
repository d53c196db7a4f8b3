package com.nodepulse.importer.orchestrator;

import com.nodepulse.importer.error.FailureKind;

import java.nio.file.Path;

/**
 * Terminal result of processing one input file.
 *
 * <p>{@code recordsCommitted} is non-zero only when the sink confirmed the
 * batch. A {@link FailureKind#RELOCATION_ERROR} outcome with committed
 * records is the "committed but not relocated" case: the data is stored but
 * the file is still at its input path and will be imported again.</p>
 *
 * @param destination where the file was moved, or {@code null} if it was not moved
 */
public record FileOutcome(
        Path file,
        Status status,
        int recordsCommitted,
        FailureKind failureKind,
        String errorMessage,
        Path destination,
        long durationMs
) {

    public enum Status {
        /** Written and moved to the done directory. */
        DONE,
        /** Not written, or written but not moved. */
        FAILED,
        /** Parsed and built without a sink; nothing written or moved. */
        DRY_RUN
    }

    public static FileOutcome done(Path file, Path destination, int records, long durationMs) {
        return new FileOutcome(file, Status.DONE, records, null, null, destination, durationMs);
    }

    public static FileOutcome dryRun(Path file, int records, long durationMs) {
        return new FileOutcome(file, Status.DRY_RUN, records, null, null, null, durationMs);
    }

    public static FileOutcome failed(Path file, FailureKind kind, String error,
                                     Path destination, long durationMs) {
        return new FileOutcome(file, Status.FAILED, 0, kind, error, destination, durationMs);
    }

    public static FileOutcome committedNotRelocated(Path file, int records, String error, long durationMs) {
        return new FileOutcome(file, Status.FAILED, records, FailureKind.RELOCATION_ERROR, error, null, durationMs);
    }

    public boolean failed() {
        return status == Status.FAILED;
    }

    public boolean committedButNotRelocated() {
        return failed() && recordsCommitted > 0;
    }
}
