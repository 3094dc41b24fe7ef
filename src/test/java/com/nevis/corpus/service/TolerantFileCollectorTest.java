package com.nevis.corpus.service;

import com.nevis.corpus.exception.CorpusReadException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TolerantFileCollectorTest {

    @TempDir
    Path root;

    @Test
    @DisplayName("Should keep walking past an entry that cannot be opened")
    void shouldContinueAfterUnreadableEntry() throws IOException {
        Path locked = Files.createDirectories(root.resolve("locked"));
        Files.writeString(root.resolve("b.txt"), "b");
        TolerantFileCollector collector = new TolerantFileCollector(root, path -> true, dir -> true);

        FileVisitResult onFailure = collector.visitFileFailed(locked, new AccessDeniedException(locked.toString()));
        FileVisitResult afterPartialListing =
            collector.postVisitDirectory(locked, new AccessDeniedException(locked.toString()));
        collector.visitFile(root.resolve("b.txt"), Files.readAttributes(root.resolve("b.txt"), BasicFileAttributes.class));

        assertThat(onFailure).isEqualTo(FileVisitResult.CONTINUE);
        assertThat(afterPartialListing).isEqualTo(FileVisitResult.CONTINUE);
        assertThat(collector.matches()).containsExactly(root.resolve("b.txt"));
    }

    @Test
    @DisplayName("Should propagate a failure on the root itself")
    void shouldFailOnUnreadableRoot() {
        TolerantFileCollector collector = new TolerantFileCollector(root, path -> true, dir -> true);

        assertThatThrownBy(() -> collector.visitFileFailed(root, new AccessDeniedException(root.toString())))
            .isInstanceOf(AccessDeniedException.class);
        assertThatThrownBy(() -> TolerantFileCollector.collect(root.resolve("missing"), path -> true, dir -> true))
            .isInstanceOf(CorpusReadException.class);
    }

    @Test
    @DisplayName("Should collect matching files in path order and prune rejected directories")
    void shouldCollectSortedMatches() throws IOException {
        Files.createDirectories(root.resolve("b"));
        Files.createDirectories(root.resolve("skip"));
        Files.writeString(root.resolve("b/2.json"), "{}");
        Files.writeString(root.resolve("a.json"), "{}");
        Files.writeString(root.resolve("a.txt"), "x");
        Files.writeString(root.resolve("skip/3.json"), "{}");

        assertThat(TolerantFileCollector.collect(root,
            path -> path.toString().endsWith(".json"),
            dir -> !dir.getFileName().toString().equals("skip")))
            .containsExactly(root.resolve("a.json"), root.resolve("b/2.json"));
    }
}
