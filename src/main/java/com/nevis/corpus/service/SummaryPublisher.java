package com.nevis.corpus.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Persists the strategic summary to its own file and into the corpus README.
 */
@Component
@Slf4j
public class SummaryPublisher {

    public static final String README_FILE = "README.md";
    static final String SECTION_HEADING = "### Latest Context Update";
    static final String STATUS_LINE = "**Status:** Processing";

    private static final Pattern SECTION_PATTERN =
        Pattern.compile("(" + Pattern.quote(SECTION_HEADING) + "\n\n)(.*?)(\n\n---)", Pattern.DOTALL);

    public void publish(Path baseDir, String summaryFile, String summary) {
        Path summaryPath = baseDir.resolve(summaryFile);
        try {
            Files.writeString(summaryPath, summary + "\n", StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write summary " + summaryPath, e);
        }
        log.info("Saved strategic summary to {}", summaryPath);

        Path readme = baseDir.resolve(README_FILE);
        if (!Files.isRegularFile(readme)) {
            log.info("{} not found in {}, summary kept in {} only", README_FILE, baseDir, summaryFile);
            return;
        }

        try {
            String content = Files.readString(readme, StandardCharsets.UTF_8);
            String updated = mergeIntoReadme(content, summary);
            if (!updated.equals(content)) {
                Files.writeString(readme, updated, StandardCharsets.UTF_8);
                log.info("Updated {} with strategic summary", readme);
            }
        } catch (IOException e) {
            log.error("Could not update {}: {}", readme, e.getMessage());
        }
    }

    /**
     * Replaces the body of the latest-context section, or adds the section after the status line,
     * or at the end when neither exists.
     */
    static String mergeIntoReadme(String content, String summary) {
        Matcher matcher = SECTION_PATTERN.matcher(content);
        if (matcher.find()) {
            return matcher.replaceAll(match ->
                Matcher.quoteReplacement(match.group(1) + summary + match.group(3)));
        }
        String section = SECTION_HEADING + "\n\n" + summary + "\n\n---";
        if (content.contains(STATUS_LINE)) {
            return content.replace(STATUS_LINE, STATUS_LINE + "\n\n" + section);
        }
        return content + "\n\n" + section + "\n";
    }
}
