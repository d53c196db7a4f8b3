package com.nodepulse.importer.orchestrator;

import com.nodepulse.importer.batch.WriteBatch;
import com.nodepulse.importer.error.SinkWriteException;
import com.nodepulse.importer.sink.BatchSink;

import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Thread-safe in-memory sink for tests. Batches whose source file name
 * contains {@code rejectMarker} are refused.
 */
class RecordingSink implements BatchSink {

    private final Queue<WriteBatch> batches = new ConcurrentLinkedQueue<>();
    private final String rejectMarker;

    RecordingSink() {
        this(null);
    }

    RecordingSink(String rejectMarker) {
        this.rejectMarker = rejectMarker;
    }

    @Override
    public void write(WriteBatch batch) throws SinkWriteException {
        if (rejectMarker != null && batch.source().getFileName().toString().contains(rejectMarker)) {
            throw new SinkWriteException("rejected " + batch.source().getFileName());
        }
        batches.add(batch);
    }

    List<WriteBatch> batches() {
        return List.copyOf(batches);
    }

    int rows() {
        return batches.stream().mapToInt(WriteBatch::size).sum();
    }
}
