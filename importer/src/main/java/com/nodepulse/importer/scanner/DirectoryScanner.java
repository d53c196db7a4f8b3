package com.nodepulse.importer.scanner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Recursively walks an input root and hands out every file whose name
 * matches a glob, by default {@value #DEFAULT_PATTERN}.
 *
 * <p>Directories whose absolute path equals one of the excluded paths are
 * pruned without being entered. Matching is by equality, not prefix. The
 * walk does not follow symbolic links and never modifies the tree.
 * Entries that vanish or cannot be read mid-walk are logged and skipped,
 * since producers keep writing into the tree while it is scanned.</p>
 */
public class DirectoryScanner implements FileSource {

    private static final Logger logger = LoggerFactory.getLogger(DirectoryScanner.class);

    public static final String DEFAULT_PATTERN = "*.json";

    private final Path root;
    private final Set<Path> excluded;
    private final PathMatcher matcher;

    public DirectoryScanner(Path root, Collection<Path> excluded) {
        this(root, excluded, DEFAULT_PATTERN);
    }

    public DirectoryScanner(Path root, Collection<Path> excluded, String pattern) {
        this.root = normalize(root);
        this.excluded = excluded.stream().map(DirectoryScanner::normalize).collect(Collectors.toUnmodifiableSet());
        this.matcher = FileSystems.getDefault().getPathMatcher("glob:" + pattern);
    }

    @Override
    public void forEachFile(Consumer<Path> action) throws IOException {
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (excluded.contains(dir)) {
                    logger.debug("Skipping excluded directory {}", dir);
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (attrs.isRegularFile() && matcher.matches(file.getFileName())) {
                    action.accept(file);
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
                logger.warn("Cannot scan {}: {}", file, exc.toString());
                return FileVisitResult.CONTINUE;
            }
        });
    }

    /** Collects one full walk into a list. */
    public List<Path> listFiles() throws IOException {
        List<Path> files = new ArrayList<>();
        forEachFile(files::add);
        return files;
    }

    private static Path normalize(Path path) {
        return path.toAbsolutePath().normalize();
    }
}
