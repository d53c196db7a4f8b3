package com.nodepulse.importer.sink;

import com.nodepulse.importer.batch.WriteBatch;
import com.nodepulse.importer.error.SinkWriteException;

/**
 * Durable storage for write batches. One instance is opened at startup and
 * shared by every worker, so implementations must accept concurrent calls.
 */
public interface BatchSink extends AutoCloseable {

    /**
     * Stores every operation of {@code batch}, returning only once the
     * storage has confirmed them.
     *
     * @throws SinkWriteException if the storage rejects or fails any operation
     */
    void write(WriteBatch batch) throws SinkWriteException;

    @Override
    default void close() {
    }
}
