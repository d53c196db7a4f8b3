package com.nodepulse.importer.sink;

import com.google.auth.oauth2.GoogleCredentials;
import com.google.cloud.bigquery.BigQuery;
import com.google.cloud.bigquery.BigQueryError;
import com.google.cloud.bigquery.BigQueryException;
import com.google.cloud.bigquery.BigQueryOptions;
import com.google.cloud.bigquery.DatasetId;
import com.google.cloud.bigquery.InsertAllRequest;
import com.google.cloud.bigquery.InsertAllResponse;
import com.google.cloud.bigquery.TableId;
import com.nodepulse.importer.batch.InsertOperation;
import com.nodepulse.importer.batch.WriteBatch;
import com.nodepulse.importer.error.SinkWriteException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link BatchSink} backed by BigQuery streaming inserts into one dataset.
 *
 * <p>Each table touched by a batch gets one {@code insertAll} request, which
 * BigQuery applies atomically. A batch spanning several tables is therefore
 * not atomic as a whole: if a later table fails, rows already sent to earlier
 * tables stay stored and the batch is still reported as failed. Every row
 * carries an insert id derived from the file's full path, the row's ordinal
 * and its content, so that re-sending the same file lets BigQuery drop
 * duplicates on a best-effort basis while distinct data never shares an id.</p>
 *
 * <p>The underlying {@link BigQuery} client is thread-safe.</p>
 */
public class BigQueryBatchSink implements BatchSink {

    private static final Logger logger = LoggerFactory.getLogger(BigQueryBatchSink.class);

    private final BigQuery bigQuery;
    private final String projectId;
    private final String dataset;

    /**
     * Production constructor. Uses the service account key in
     * {@code credentialsFile} when given, otherwise application default
     * credentials.
     */
    public BigQueryBatchSink(String projectId, String dataset, String credentialsFile) throws IOException {
        BigQueryOptions.Builder options = BigQueryOptions.newBuilder().setProjectId(projectId);
        if (credentialsFile != null && !credentialsFile.isBlank()) {
            try (InputStream in = Files.newInputStream(Path.of(credentialsFile))) {
                options.setCredentials(GoogleCredentials.fromStream(in));
            }
        }
        this.bigQuery = options.build().getService();
        this.projectId = projectId;
        this.dataset = dataset;
        logger.info("BigQueryBatchSink initialized for {}.{}", projectId, dataset);
    }

    /**
     * Test constructor. Accepts an injected BigQuery client for mocking.
     */
    BigQueryBatchSink(BigQuery bigQuery, String projectId, String dataset) {
        this.bigQuery = bigQuery;
        this.projectId = projectId;
        this.dataset = dataset;
    }

    /**
     * Fails fast when the target dataset is missing. Tables are not created:
     * they must exist with the columns the records carry.
     */
    public void verifyDataset() {
        if (bigQuery.getDataset(DatasetId.of(projectId, dataset)) == null) {
            throw new IllegalStateException("Dataset does not exist: " + projectId + "." + dataset);
        }
        logger.debug("Dataset {}.{} exists", projectId, dataset);
    }

    @Override
    public void write(WriteBatch batch) throws SinkWriteException {
        String fileName = batch.source().getFileName().toString();
        String source = batch.source().toAbsolutePath().normalize().toString();

        Map<String, InsertAllRequest.Builder> requests = new LinkedHashMap<>();
        List<InsertOperation> operations = batch.operations();
        for (int i = 0; i < operations.size(); i++) {
            InsertOperation op = operations.get(i);
            requests.computeIfAbsent(op.tableName(),
                            table -> InsertAllRequest.newBuilder(TableId.of(projectId, dataset, table)))
                    .addRow(insertId(source, i, op), toRow(op));
        }

        for (Map.Entry<String, InsertAllRequest.Builder> entry : requests.entrySet()) {
            insert(entry.getKey(), entry.getValue().build());
        }
        logger.debug("Stored {} rows from {} in {} table(s)", batch.size(), fileName, requests.size());
    }

    private void insert(String table, InsertAllRequest request) throws SinkWriteException {
        InsertAllResponse response;
        try {
            response = bigQuery.insertAll(request);
        } catch (BigQueryException e) {
            throw new SinkWriteException(String.format(
                    "insert into %s.%s failed: %s", dataset, table, e.getMessage()), e);
        }

        if (response.hasErrors()) {
            List<String> messages = new ArrayList<>();
            for (Map.Entry<Long, List<BigQueryError>> entry : response.getInsertErrors().entrySet()) {
                for (BigQueryError error : entry.getValue()) {
                    messages.add("row " + entry.getKey() + ": " + error.getMessage());
                    logger.debug("Insert error in {}.{} row {}: {} (reason: {})",
                            dataset, table, entry.getKey(), error.getMessage(), error.getReason());
                }
            }
            throw new SinkWriteException(String.format("%d of %d rows rejected by %s.%s (%s)",
                    response.getInsertErrors().size(), request.getRows().size(), dataset, table,
                    String.join("; ", messages)));
        }
    }

    static String insertId(String source, int ordinal, InsertOperation op) {
        String input = source + "\n" + ordinal + "\n" + op.describe();
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(input.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            // every JVM ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    // Absent columns are NULL in BigQuery, so JSON nulls are left out of the row.
    private static Map<String, Object> toRow(InsertOperation op) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (int c = 0; c < op.columns().size(); c++) {
            Object value = op.values().get(c);
            if (value != null) {
                row.put(op.columns().get(c), value);
            }
        }
        return row;
    }
}
