package com.nodepulse.importer.validation;

import com.nodepulse.importer.model.MeasurementRecord;

/**
 * Semantic check applied to each record before its batch is built.
 */
@FunctionalInterface
public interface RecordValidator {

    /**
     * @param record    the record to check
     * @param verbosity values above 1 log each decision
     * @return {@code true} if the record may be imported
     */
    boolean accepts(MeasurementRecord record, int verbosity);

    static RecordValidator acceptAll() {
        return (record, verbosity) -> true;
    }
}
