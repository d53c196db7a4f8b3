package com.nodepulse.importer.orchestrator;

import com.nodepulse.importer.error.FailureKind;
import com.nodepulse.importer.error.FileImportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Moves finished input files into the done or failed directory. Moves are
 * atomic renames, so a move across file systems fails instead of degrading
 * into copy-and-delete.
 *
 * <p>A file never replaces another one: when the file name is already taken
 * in the target directory, a counter is added before the extension
 * ({@code ping.json}, {@code ping-1.json}, {@code ping-2.json}, ...).</p>
 */
public class FileRelocator {

    private static final Logger logger = LoggerFactory.getLogger(FileRelocator.class);

    private static final int MAX_SUFFIX = 10_000;

    private final Path failedDir;
    private final Path doneDir;

    public FileRelocator(Path failedDir, Path doneDir) {
        this.failedDir = failedDir;
        this.doneDir = doneDir;
    }

    /**
     * @return where the file ended up
     */
    public Path moveToDone(Path file) throws FileImportException {
        return move(file, doneDir);
    }

    /**
     * @return where the file ended up
     */
    public Path moveToFailed(Path file) throws FileImportException {
        return move(file, failedDir);
    }

    private static Path move(Path file, Path dir) throws FileImportException {
        Path destination = null;
        try {
            destination = reserve(dir, file.getFileName().toString());
            return Files.move(file, destination, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            releaseQuietly(destination, e);
            throw new FileImportException(FailureKind.RELOCATION_ERROR,
                    "could not move " + file + " to " + dir + ": " + e, e);
        }
    }

    // createFile is atomic, so concurrent workers never claim the same name
    private static Path reserve(Path dir, String fileName) throws IOException {
        int dot = fileName.lastIndexOf('.');
        String base = dot > 0 ? fileName.substring(0, dot) : fileName;
        String extension = dot > 0 ? fileName.substring(dot) : "";

        for (int n = 0; n < MAX_SUFFIX; n++) {
            Path candidate = dir.resolve(n == 0 ? fileName : base + "-" + n + extension);
            try {
                return Files.createFile(candidate);
            } catch (FileAlreadyExistsException e) {
                logger.debug("{} already exists, trying the next name", candidate);
            }
        }
        throw new FileAlreadyExistsException(dir.resolve(fileName).toString(), null,
                "no free name after " + MAX_SUFFIX + " attempts");
    }

    private static void releaseQuietly(Path placeholder, IOException failure) {
        if (placeholder == null) {
            return;
        }
        try {
            Files.deleteIfExists(placeholder);
        } catch (IOException e) {
            failure.addSuppressed(e);
        }
    }
}
