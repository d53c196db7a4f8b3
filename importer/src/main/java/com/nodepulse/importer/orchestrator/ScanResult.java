package com.nodepulse.importer.orchestrator;

import com.nodepulse.importer.error.FailureKind;

import java.util.List;

/**
 * Aggregate of one pass over the input tree.
 */
public record ScanResult(
        List<FileOutcome> outcomes,
        long durationMs
) {

    public ScanResult {
        outcomes = List.copyOf(outcomes);
    }

    public int filesScanned() {
        return outcomes.size();
    }

    public long recordsCommitted() {
        return outcomes.stream().mapToLong(FileOutcome::recordsCommitted).sum();
    }

    public int filesFailed() {
        return (int) outcomes.stream().filter(FileOutcome::failed).count();
    }

    public boolean hasFailures() {
        return outcomes.stream().anyMatch(FileOutcome::failed);
    }

    public long failuresOf(FailureKind kind) {
        return outcomes.stream().filter(o -> o.failed() && o.failureKind() == kind).count();
    }
}
