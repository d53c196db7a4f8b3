package com.nodepulse.importer.error;

/**
 * The sink did not confirm durability of a batch.
 */
public class SinkWriteException extends FileImportException {

    public SinkWriteException(String message) {
        super(FailureKind.SINK_WRITE_ERROR, message);
    }

    public SinkWriteException(String message, Throwable cause) {
        super(FailureKind.SINK_WRITE_ERROR, message, cause);
    }
}
