package com.nodepulse.importer.batch;

import com.nodepulse.importer.model.MeasurementRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A single insert derived from one record: target table plus matched,
 * equally ordered column and value lists.
 */
public record InsertOperation(
        String tableName,
        List<String> columns,
        List<Object> values,
        MeasurementRecord record
) {

    public InsertOperation {
        if (columns.size() != values.size()) {
            throw new IllegalArgumentException(String.format(
                    "%d columns but %d values for table %s", columns.size(), values.size(), tableName));
        }
        columns = List.copyOf(columns);
        // values may legitimately contain JSON nulls
        values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    /**
     * Parameterized statement text, e.g.
     * {@code INSERT INTO MONROE_EXP_PING (DataId,Rtt) VALUES (?,?)}.
     */
    public String statement() {
        String placeholders = columns.stream().map(c -> "?").collect(Collectors.joining(","));
        return "INSERT INTO " + tableName + " (" + String.join(",", columns) + ") VALUES (" + placeholders + ")";
    }

    /** Statement followed by its bound values, as shown in dry-run output. */
    public String describe() {
        String bound = values.stream().map(String::valueOf).collect(Collectors.joining(","));
        return statement() + " (" + bound + ")";
    }
}
