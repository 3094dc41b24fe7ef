package com.nevis.corpus.infra;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ErrorLogWriterTest {

    private final ErrorLogWriter writer = new ErrorLogWriter();

    @TempDir
    Path tempDir;

    @Test
    void shouldWriteMessageAndNonEmptySections() throws IOException {
        Map<String, String> sections = new LinkedHashMap<>();
        sections.put("RAW RESPONSE (first 2000 chars):", "not json");
        sections.put("ATTEMPTED JSON TEXT:", "");

        Path target = tempDir.resolve("nested/doc_extraction_error.log");
        assertThat(writer.write(target, "  JSON Parse Error: boom  ", sections)).contains(target);

        String content = Files.readString(target);
        assertThat(content).startsWith("JSON Parse Error: boom\n\n");
        assertThat(content).contains("=".repeat(80) + "\nRAW RESPONSE (first 2000 chars):\n" + "=".repeat(80) + "\nnot json");
        assertThat(content).doesNotContain("ATTEMPTED JSON TEXT:");
    }

    @Test
    void shouldCapSectionContent() throws IOException {
        Path target = tempDir.resolve("error.log");
        writer.write(target, "failed", Map.of("RAW", "x".repeat(5000)));

        String content = Files.readString(target);
        assertThat(content).contains("x".repeat(ErrorLogWriter.EXCERPT_LIMIT));
        assertThat(content).doesNotContain("x".repeat(ErrorLogWriter.EXCERPT_LIMIT + 1));
    }
}
