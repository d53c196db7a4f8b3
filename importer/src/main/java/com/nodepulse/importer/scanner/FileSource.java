package com.nodepulse.importer.scanner;

import java.io.IOException;
import java.nio.file.Path;
import java.util.function.Consumer;

/**
 * Supplies the candidate files for one pass. Each path is handed out at
 * most once per call.
 */
@FunctionalInterface
public interface FileSource {

    void forEachFile(Consumer<Path> action) throws IOException;
}
