package com.nodepulse.importer.error;

/**
 * Raised by any stage of a single file's import. Never escapes the
 * {@code FileProcessor}, which turns it into a failed outcome.
 */
public class FileImportException extends Exception {

    private final FailureKind kind;

    public FileImportException(FailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public FileImportException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public FailureKind getKind() {
        return kind;
    }
}
