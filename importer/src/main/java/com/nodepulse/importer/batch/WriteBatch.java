package com.nodepulse.importer.batch;

import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * All inserts built from one input file. Submitted to the sink as a unit.
 */
public record WriteBatch(
        Path source,
        List<InsertOperation> operations
) {

    public WriteBatch {
        operations = List.copyOf(operations);
    }

    public int size() {
        return operations.size();
    }

    /** Target tables in first-use order. */
    public Set<String> tableNames() {
        Set<String> tables = new LinkedHashSet<>();
        operations.forEach(op -> tables.add(op.tableName()));
        return tables;
    }
}
