package com.nevis.corpus.infra;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/**
 * Writes the plain-text error artifact that accompanies every partially failed item.
 */
@Component
@Slf4j
public class ErrorLogWriter {

    public static final int EXCERPT_LIMIT = 2000;

    private static final String RULE = "=".repeat(80);

    public Optional<Path> write(Path target, String message, Map<String, String> sections) {
        StringBuilder out = new StringBuilder(message.strip()).append("\n\n");
        sections.forEach((title, content) -> {
            if (content == null || content.isEmpty()) {
                return;
            }
            out.append(RULE).append('\n')
                .append(title).append('\n')
                .append(RULE).append('\n')
                .append(excerpt(content.strip())).append("\n\n");
        });

        try {
            if (target.getParent() != null) {
                Files.createDirectories(target.getParent());
            }
            Files.writeString(target, out.toString(), StandardCharsets.UTF_8);
            return Optional.of(target);
        } catch (IOException e) {
            log.error("Could not write error log {}: {}", target, e.getMessage());
            return Optional.empty();
        }
    }

    public static String excerpt(String value) {
        return value.length() <= EXCERPT_LIMIT ? value : value.substring(0, EXCERPT_LIMIT);
    }
}
