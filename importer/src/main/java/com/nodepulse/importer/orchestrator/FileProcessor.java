package com.nodepulse.importer.orchestrator;

import com.nodepulse.importer.batch.BatchBuilder;
import com.nodepulse.importer.batch.InsertOperation;
import com.nodepulse.importer.batch.WriteBatch;
import com.nodepulse.importer.error.FailureKind;
import com.nodepulse.importer.error.FileImportException;
import com.nodepulse.importer.error.SinkWriteException;
import com.nodepulse.importer.model.MeasurementRecord;
import com.nodepulse.importer.parser.ParsedFile;
import com.nodepulse.importer.parser.RecordParser;
import com.nodepulse.importer.sink.BatchSink;
import com.nodepulse.importer.validation.RecordValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Imports a single file: read, parse, build, validate, write, relocate.
 *
 * <p>The file is written as one batch or not at all. It moves to the done
 * directory only after the sink confirmed the batch, and to the failed
 * directory on any earlier failure. Files are never deleted.</p>
 *
 * <p>Without a sink the processor runs dry: it parses and builds, prints
 * the statements it would execute and any failure to the console, and
 * leaves every file where it is.</p>
 *
 * <p>{@link #process(Path)} never throws; every problem becomes a failed
 * {@link FileOutcome}. Thread-safe as long as the sink is.</p>
 */
public class FileProcessor {

    private static final Logger logger = LoggerFactory.getLogger(FileProcessor.class);

    private final RecordParser parser;
    private final BatchBuilder batchBuilder;
    private final RecordValidator validator;
    private final BatchSink sink;
    private final FileRelocator relocator;
    private final int verbosity;
    private final PrintStream console;

    /**
     * @param validator record check, or {@code null} to skip validation
     * @param sink      batch destination, or {@code null} for a dry run
     */
    public FileProcessor(RecordParser parser, BatchBuilder batchBuilder, RecordValidator validator,
                         BatchSink sink, FileRelocator relocator, int verbosity) {
        this(parser, batchBuilder, validator, sink, relocator, verbosity, System.out);
    }

    // Visible for testing
    FileProcessor(RecordParser parser, BatchBuilder batchBuilder, RecordValidator validator,
                  BatchSink sink, FileRelocator relocator, int verbosity, PrintStream console) {
        this.parser = parser;
        this.batchBuilder = batchBuilder;
        this.validator = validator;
        this.sink = sink;
        this.relocator = relocator;
        this.verbosity = verbosity;
        this.console = console;
    }

    public boolean isDryRun() {
        return sink == null;
    }

    /**
     * Runs one file to a terminal state.
     *
     * @return the outcome; {@code recordsCommitted} is 0 unless the sink stored the batch
     */
    public FileOutcome process(Path file) {
        long start = System.currentTimeMillis();

        WriteBatch batch;
        try {
            batch = prepare(file);
        } catch (FileImportException e) {
            return fail(file, e.getKind(), e.getMessage(), null, start);
        } catch (IOException e) {
            return fail(file, FailureKind.PARSE_ERROR, "could not read file: " + e, null, start);
        } catch (RuntimeException e) {
            return fail(file, FailureKind.INTERNAL_ERROR, e.toString(), e, start);
        }

        if (isDryRun()) {
            for (InsertOperation op : batch.operations()) {
                console.println("Statement: " + op.describe());
            }
            console.printf("Would execute batch of %d inserts on file %s%n", batch.size(), file);
            return FileOutcome.dryRun(file, batch.size(), elapsed(start));
        }

        try {
            sink.write(batch);
        } catch (SinkWriteException e) {
            return fail(file, e.getKind(), e.getMessage(), e.getCause(), start);
        } catch (RuntimeException e) {
            return fail(file, FailureKind.SINK_WRITE_ERROR, e.toString(), e, start);
        }

        try {
            Path destination = relocator.moveToDone(file);
            logger.debug("Imported {} records from {}, moved to {}", batch.size(), file, destination);
            return FileOutcome.done(file, destination, batch.size(), elapsed(start));
        } catch (FileImportException e) {
            logger.error("COMMITTED_NOT_RELOCATED: {} records from {} are stored but the file is still in place "
                    + "and will be imported again: {}", batch.size(), file, e.getMessage());
            return FileOutcome.committedNotRelocated(file, batch.size(), e.getMessage(), elapsed(start));
        }
    }

    private WriteBatch prepare(Path file) throws IOException, FileImportException {
        // a zero-byte file may still be open by its producer
        if (Files.size(file) == 0) {
            throw new FileImportException(FailureKind.EMPTY_FILE, "zero file size");
        }

        ParsedFile parsed;
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            parsed = parser.parse(reader, file.toString());
        }
        if (parsed.isEmpty()) {
            throw new FileImportException(FailureKind.EMPTY_FILE, "no records in file");
        }
        if (parsed.multiLineRecords()) {
            logger.warn("Possible performance hit: file {} contains records spanning several lines", file);
        }

        // building first reports a missing DataId as such, not as a rejection
        WriteBatch batch = batchBuilder.build(file, parsed.records());

        if (validator != null) {
            List<MeasurementRecord> records = parsed.records();
            for (int i = 0; i < records.size(); i++) {
                if (!validator.accepts(records.get(i), verbosity)) {
                    throw new FileImportException(FailureKind.VALIDATION_REJECTED, String.format(
                            "record %d (%s) rejected by validator", i + 1, records.get(i).dataId()));
                }
            }
        }
        return batch;
    }

    private FileOutcome fail(Path file, FailureKind kind, String message, Throwable cause, long start) {
        if (isDryRun()) {
            console.printf("%s: %s in file %s (dry run, not moved)%n", kind, message, file);
            return FileOutcome.failed(file, kind, message, null, elapsed(start));
        }

        Path destination;
        try {
            destination = relocator.moveToFailed(file);
        } catch (FileImportException e) {
            logger.error("{}: {} in file {}, left in place: {}", kind, message, file, e.getMessage(), cause);
            return FileOutcome.failed(file, kind, message, null, elapsed(start));
        }

        if (cause != null) {
            logger.error("{}: {} in file {} moving to {}", kind, message, file, destination, cause);
        } else {
            logger.error("{}: {} in file {} moving to {}", kind, message, file, destination);
        }
        return FileOutcome.failed(file, kind, message, destination, elapsed(start));
    }

    private static long elapsed(long start) {
        return System.currentTimeMillis() - start;
    }
}
