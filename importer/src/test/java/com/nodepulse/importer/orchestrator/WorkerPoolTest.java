package com.nodepulse.importer.orchestrator;

import com.nodepulse.importer.batch.BatchBuilder;
import com.nodepulse.importer.error.FailureKind;
import com.nodepulse.importer.parser.RecordParser;
import com.nodepulse.importer.scanner.DirectoryScanner;
import com.nodepulse.importer.scanner.FileSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Tests for {@link WorkerPool}: aggregation, isolation of failing tasks and
 * the in-flight bound.
 */
@ExtendWith(MockitoExtension.class)
class WorkerPoolTest {

    @TempDir
    Path tmp;

    @Mock
    private FileProcessor mockProcessor;

    /**
     * Builds a fixed input tree: 12 good files of 3 records, 2 empty files,
     * 2 truncated files and 1 file the sink rejects.
     */
    private Path createTree(String name) throws IOException {
        Path root = Files.createDirectories(tmp.resolve(name));
        Files.createDirectories(root.resolve("failed"));
        Files.createDirectories(root.resolve("processed"));
        String record = "{\"DataId\": \"MONROE.EXP.PING\", \"SequenceNumber\": 1}\n";
        for (int i = 0; i < 12; i++) {
            Path dir = Files.createDirectories(root.resolve("node" + (i % 3)));
            Files.writeString(dir.resolve("good-" + i + ".json"), record.repeat(3));
        }
        Files.writeString(root.resolve("empty-1.json"), "");
        Files.writeString(root.resolve("node0/empty-2.json"), "");
        Files.writeString(root.resolve("truncated-1.json"), record + "{\"DataId\":");
        Files.writeString(root.resolve("node1/truncated-2.json"), "{\n\"DataId\": \"x\"");
        Files.writeString(root.resolve("node2/reject-me.json"), record);
        return root;
    }

    private ScanResult runPass(Path root, int concurrency) {
        FileProcessor processor = new FileProcessor(new RecordParser(), new BatchBuilder(), null,
                new RecordingSink("reject"),
                new FileRelocator(root.resolve("failed"), root.resolve("processed")), 0);
        DirectoryScanner scanner = new DirectoryScanner(root,
                List.of(root.resolve("failed"), root.resolve("processed")));
        return new WorkerPool(processor, concurrency).run(scanner);
    }

    @Test
    @DisplayName("A pass aggregates files scanned, records committed and files failed")
    void aggregatesOutcomes() throws IOException {
        Path root = createTree("tree");

        ScanResult result = runPass(root, 4);

        assertEquals(17, result.filesScanned());
        assertEquals(36, result.recordsCommitted());
        assertEquals(5, result.filesFailed());
        assertEquals(2, result.failuresOf(FailureKind.EMPTY_FILE));
        assertEquals(2, result.failuresOf(FailureKind.PARSE_ERROR));
        assertEquals(1, result.failuresOf(FailureKind.SINK_WRITE_ERROR));

        try (var done = Files.list(root.resolve("processed"))) {
            assertEquals(12, done.count());
        }
        try (var failed = Files.list(root.resolve("failed"))) {
            assertEquals(5, failed.count());
        }
    }

    @Test
    @DisplayName("Concurrency 1 and 8 over the same file set yield identical aggregates")
    void concurrencyDoesNotChangeCounts() throws IOException {
        ScanResult serial = runPass(createTree("serial"), 1);
        ScanResult parallel = runPass(createTree("parallel"), 8);

        assertEquals(serial.filesScanned(), parallel.filesScanned());
        assertEquals(serial.recordsCommitted(), parallel.recordsCommitted());
        assertEquals(serial.filesFailed(), parallel.filesFailed());
    }

    @Test
    @DisplayName("A second pass finds nothing once every file has been relocated")
    void secondPassFindsNothing() throws IOException {
        Path root = createTree("rerun");
        runPass(root, 2);

        ScanResult second = runPass(root, 2);

        assertEquals(0, second.filesScanned());
    }

    @Test
    @DisplayName("A task that throws becomes a failed outcome without affecting its siblings")
    void throwingTask_isolated() {
        Path a = Path.of("a.json");
        Path b = Path.of("b.json");
        Path c = Path.of("c.json");
        when(mockProcessor.process(any(Path.class)))
                .thenAnswer(inv -> FileOutcome.done(inv.getArgument(0), null, 5, 1));
        when(mockProcessor.process(eq(b))).thenThrow(new IllegalStateException("boom"));

        FileSource source = action -> List.of(a, b, c).forEach(action);
        ScanResult result = new WorkerPool(mockProcessor, 3).run(source);

        assertEquals(3, result.filesScanned());
        assertEquals(10, result.recordsCommitted());
        assertEquals(1, result.filesFailed());
        FileOutcome crashed = result.outcomes().get(1);
        assertEquals(b, crashed.file());
        assertEquals(FailureKind.INTERNAL_ERROR, crashed.failureKind());
        assertTrue(crashed.errorMessage().contains("boom"));
    }

    @Test
    @DisplayName("Never more than the configured number of files are in flight")
    void boundsInFlightWork() {
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        when(mockProcessor.process(any(Path.class))).thenAnswer(inv -> {
            int now = inFlight.incrementAndGet();
            maxInFlight.accumulateAndGet(now, Math::max);
            Thread.sleep(20);
            inFlight.decrementAndGet();
            return FileOutcome.done(inv.getArgument(0), null, 1, 20);
        });

        FileSource source = action -> {
            for (int i = 0; i < 20; i++) {
                action.accept(Path.of("f" + i + ".json"));
            }
        };
        ScanResult result = new WorkerPool(mockProcessor, 3).run(source);

        assertEquals(20, result.filesScanned());
        assertTrue(maxInFlight.get() <= 3, "max in flight was " + maxInFlight.get());
        assertTrue(maxInFlight.get() >= 1);
    }

    @Test
    @DisplayName("A source that fails mid-walk still returns outcomes for files already submitted")
    void sourceFailure_keepsSubmittedOutcomes() {
        when(mockProcessor.process(any(Path.class)))
                .thenAnswer(inv -> FileOutcome.done(inv.getArgument(0), null, 2, 1));

        FileSource source = action -> {
            action.accept(Path.of("first.json"));
            throw new IOException("device gone");
        };
        ScanResult result = new WorkerPool(mockProcessor, 2).run(source);

        assertEquals(1, result.filesScanned());
        assertEquals(2, result.recordsCommitted());
    }

    @Test
    @DisplayName("Every submitted file appears exactly once in the result")
    void everyFileOnce() {
        when(mockProcessor.process(any(Path.class)))
                .thenAnswer(inv -> FileOutcome.done(inv.getArgument(0), null, 1, 1));
        List<Path> files = List.of(Path.of("x.json"), Path.of("y.json"), Path.of("z.json"));

        ScanResult result = new WorkerPool(mockProcessor, 2).run(files::forEach);

        Set<Path> seen = result.outcomes().stream().map(FileOutcome::file).collect(Collectors.toSet());
        assertEquals(Set.copyOf(files), seen);
    }

    @Test
    @DisplayName("Concurrency below one is rejected")
    void invalidConcurrency() {
        assertThrows(IllegalArgumentException.class, () -> new WorkerPool(mockProcessor, 0));
    }
}
