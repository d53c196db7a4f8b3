package com.nodepulse.importer.parser;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.core.StreamReadFeature;
import com.fasterxml.jackson.core.io.JsonEOFException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nodepulse.importer.error.FailureKind;
import com.nodepulse.importer.error.FileImportException;
import com.nodepulse.importer.model.MeasurementRecord;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Decodes newline-delimited JSON objects from a text stream.
 *
 * <p>Each object must end at a line boundary. An object may span several
 * physical lines: when the lines read so far end inside a value, the next
 * line is appended and decoding is retried. Any other decode problem fails
 * the whole file immediately, as does reaching the end of the stream while
 * an object is still open.</p>
 *
 * <p>Thread-safe: holds only a configured {@link ObjectMapper}.</p>
 */
public class RecordParser {

    private static final TypeReference<LinkedHashMap<String, Object>> FIELDS_TYPE =
            new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public RecordParser() {
        JsonFactory factory = JsonFactory.builder()
                .enable(StreamReadFeature.STRICT_DUPLICATE_DETECTION)
                .build();
        this.objectMapper = new ObjectMapper(factory);
    }

    /**
     * Reads every record from {@code input}.
     *
     * @param input      the file contents; not closed by this method
     * @param sourceName name used in error messages
     * @return the decoded records in file order
     * @throws FileImportException with {@link FailureKind#PARSE_ERROR} when a
     *                             record is invalid or truncated
     * @throws IOException         when the stream cannot be read
     */
    public ParsedFile parse(Reader input, String sourceName) throws IOException, FileImportException {
        BufferedReader reader = input instanceof BufferedReader br ? br : new BufferedReader(input);

        List<MeasurementRecord> records = new ArrayList<>();
        boolean multiLine = false;

        StringBuilder buffer = new StringBuilder();
        int bufferedLines = 0;
        int recordStartLine = 0;
        int lineNumber = 0;

        String line;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            if (bufferedLines == 0) {
                if (line.isBlank()) {
                    continue;
                }
                recordStartLine = lineNumber;
            } else {
                buffer.append('\n');
            }
            buffer.append(line);
            bufferedLines++;

            MeasurementRecord record = tryDecode(buffer, sourceName, recordStartLine);
            if (record != null) {
                records.add(record);
                multiLine |= bufferedLines > 1;
                buffer.setLength(0);
                bufferedLines = 0;
            }
        }

        if (bufferedLines > 0) {
            throw new FileImportException(FailureKind.PARSE_ERROR, String.format(
                    "end of input inside record starting at line %d of %s", recordStartLine, sourceName));
        }
        return new ParsedFile(records, multiLine);
    }

    /**
     * Returns the decoded record, or {@code null} when the buffer ends inside
     * an object and more input is needed.
     */
    private MeasurementRecord tryDecode(CharSequence buffer, String sourceName, int startLine)
            throws FileImportException {
        String text = buffer.toString();
        try (JsonParser parser = objectMapper.getFactory().createParser(text)) {
            JsonToken first = parser.nextToken();
            if (first != JsonToken.START_OBJECT) {
                throw new FileImportException(FailureKind.PARSE_ERROR, String.format(
                        "expected a JSON object at line %d of %s but found %s", startLine, sourceName, first));
            }
            parser.skipChildren();
            JsonToken trailing = parser.nextToken();
            if (trailing != null) {
                throw new FileImportException(FailureKind.PARSE_ERROR, String.format(
                        "unexpected %s after record starting at line %d of %s", trailing, startLine, sourceName));
            }
        } catch (JsonEOFException e) {
            return null;
        } catch (JsonProcessingException e) {
            throw invalid(e, sourceName, startLine);
        } catch (IOException e) {
            throw new FileImportException(FailureKind.PARSE_ERROR, "could not decode " + sourceName, e);
        }

        try {
            return new MeasurementRecord(objectMapper.readValue(text, FIELDS_TYPE));
        } catch (JsonProcessingException e) {
            throw invalid(e, sourceName, startLine);
        }
    }

    private static FileImportException invalid(JsonProcessingException e, String sourceName, int startLine) {
        return new FileImportException(FailureKind.PARSE_ERROR, String.format(
                "invalid record starting at line %d of %s: %s", startLine, sourceName, e.getOriginalMessage()), e);
    }
}
