package com.nodepulse.importer.parser;

import com.nodepulse.importer.model.MeasurementRecord;

import java.util.List;

/**
 * Records decoded from one input file, in file order.
 *
 * @param records          decoded records
 * @param multiLineRecords true when at least one record spanned more than one physical line
 */
public record ParsedFile(
        List<MeasurementRecord> records,
        boolean multiLineRecords
) {

    public ParsedFile {
        records = List.copyOf(records);
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }
}
