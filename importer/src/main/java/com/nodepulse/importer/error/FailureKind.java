package com.nodepulse.importer.error;

/**
 * Classification of why a single input file could not be imported.
 */
public enum FailureKind {

    /** The file had zero bytes, or no records at all. */
    EMPTY_FILE,

    /** A structured value was invalid, or the stream ended inside one. */
    PARSE_ERROR,

    /** A record lacked the field that names its target table. */
    MISSING_DISCRIMINATOR,

    /** The record validator rejected a record. */
    VALIDATION_REJECTED,

    /** The sink refused or failed the batch. */
    SINK_WRITE_ERROR,

    /** The file could not be moved to its destination directory. */
    RELOCATION_ERROR,

    /** Anything else thrown while a worker handled the file. */
    INTERNAL_ERROR
}
