package com.nevis.corpus.service;

import com.nevis.corpus.exception.CorpusReadException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Predicate;

/**
 * Collects matching regular files below a root. Entries that cannot be visited are logged and skipped;
 * only a failure on the root itself aborts the walk.
 */
@Slf4j
class TolerantFileCollector extends SimpleFileVisitor<Path> {

    private final Path root;
    private final Predicate<Path> fileFilter;
    private final Predicate<Path> directoryFilter;
    private final List<Path> matches = new ArrayList<>();

    TolerantFileCollector(Path root, Predicate<Path> fileFilter, Predicate<Path> directoryFilter) {
        this.root = root;
        this.fileFilter = fileFilter;
        this.directoryFilter = directoryFilter;
    }

    static List<Path> collect(Path root, Predicate<Path> fileFilter, Predicate<Path> directoryFilter) {
        TolerantFileCollector collector = new TolerantFileCollector(root, fileFilter, directoryFilter);
        try {
            Files.walkFileTree(root, collector);
        } catch (IOException e) {
            throw new CorpusReadException(root, e);
        }
        return collector.matches();
    }

    @Override
    public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
        if (!dir.equals(root) && !directoryFilter.test(dir)) {
            return FileVisitResult.SKIP_SUBTREE;
        }
        return FileVisitResult.CONTINUE;
    }

    @Override
    public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
        if (attrs.isRegularFile() && fileFilter.test(file)) {
            matches.add(file);
        }
        return FileVisitResult.CONTINUE;
    }

    @Override
    public FileVisitResult visitFileFailed(Path file, IOException exc) throws IOException {
        if (file.equals(root)) {
            throw exc;
        }
        log.warn("Skipping unreadable entry {}: {}", file, exc.getMessage());
        return FileVisitResult.CONTINUE;
    }

    @Override
    public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
        if (exc != null) {
            if (dir.equals(root)) {
                throw exc;
            }
            log.warn("Directory {} was only partly listed: {}", dir, exc.getMessage());
        }
        return FileVisitResult.CONTINUE;
    }

    List<Path> matches() {
        return matches.stream().sorted(Comparator.comparing(Path::toString)).toList();
    }
}
