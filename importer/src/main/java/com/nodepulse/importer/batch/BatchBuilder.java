package com.nodepulse.importer.batch;

import com.nodepulse.importer.error.FailureKind;
import com.nodepulse.importer.error.FileImportException;
import com.nodepulse.importer.model.MeasurementRecord;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns the records of one file into a single {@link WriteBatch}.
 *
 * <p>The table name comes from the record's {@code DataId} with every
 * {@code '.'} replaced by {@code '_'}, so {@code MONROE.EXP.PING} is written
 * to {@code MONROE_EXP_PING}. Columns are taken from the record as-is;
 * whether they exist, and with which types, is for the sink to decide.</p>
 */
public class BatchBuilder {

    static final char SOURCE_SEPARATOR = '.';
    static final char TABLE_SEPARATOR = '_';

    /**
     * Builds the batch for {@code source}.
     *
     * @throws FileImportException with {@link FailureKind#MISSING_DISCRIMINATOR}
     *                             if any record has no usable {@code DataId};
     *                             no batch is produced in that case
     */
    public WriteBatch build(Path source, List<MeasurementRecord> records) throws FileImportException {
        List<InsertOperation> operations = new ArrayList<>(records.size());
        for (int i = 0; i < records.size(); i++) {
            MeasurementRecord record = records.get(i);
            String dataId = record.dataId();
            if (dataId == null || dataId.isBlank()) {
                throw new FileImportException(FailureKind.MISSING_DISCRIMINATOR, String.format(
                        "record %d has no string field %s", i + 1, MeasurementRecord.DATA_ID_FIELD));
            }
            operations.add(new InsertOperation(
                    tableName(dataId),
                    new ArrayList<>(record.fields().keySet()),
                    new ArrayList<>(record.fields().values()),
                    record));
        }
        return new WriteBatch(source, operations);
    }

    public static String tableName(String dataId) {
        return dataId.replace(SOURCE_SEPARATOR, TABLE_SEPARATOR);
    }
}
