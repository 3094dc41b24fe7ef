package com.nevis.corpus.repository;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

@Repository
@Slf4j
public class FileSystemGroupingRepository implements GroupingRepository {

    @Override
    public void saveInput(Path lettersDir, String listing) {
        write(lettersDir.resolve(INPUT_FILE), listing);
        log.info("Saved grouping input listing to {}", lettersDir.resolve(INPUT_FILE));
    }

    @Override
    public void saveRawResponse(Path lettersDir, String rawResponse) {
        write(lettersDir.resolve(RESPONSE_FILE), rawResponse);
        log.info("Saved grouping JSON to {}", lettersDir.resolve(RESPONSE_FILE));
    }

    @Override
    public Optional<String> findRawResponse(Path lettersDir) {
        Path file = lettersDir.resolve(RESPONSE_FILE);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read cached grouping " + file, e);
        }
    }

    private static void write(Path file, String content) {
        try {
            if (file.getParent() != null) {
                Files.createDirectories(file.getParent());
            }
            Files.writeString(file, content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write " + file, e);
        }
    }
}
