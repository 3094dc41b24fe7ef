package com.nevis.corpus.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.nevis.corpus.exception.LetterWriteException;
import com.nevis.corpus.model.Letter;
import com.nevis.corpus.model.ProposedGroup;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileSystemLetterRepositoryTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final FileSystemLetterRepository repository = new FileSystemLetterRepository(objectMapper);

    @TempDir
    Path workDir;

    private static Letter letter(String folderName) {
        ProposedGroup group = new ProposedGroup(folderName, List.of("A"), 0.8, null, null);
        return new Letter(folderName, folderName, List.of("A"), "Lieber Hans,",
            List.of("german_output/A_german.txt"), List.of(), group);
    }

    @Test
    @DisplayName("Should replace an existing letter folder")
    void shouldWriteLetterFolder() throws IOException {
        Path lettersDir = Files.createDirectories(workDir.resolve("letters"));
        Files.createDirectories(lettersDir.resolve("C L0001"));
        Files.writeString(lettersDir.resolve("C L0001/stale.txt"), "old");

        repository.save(lettersDir, letter("C L0001"));

        Path folder = lettersDir.resolve("C L0001");
        assertThat(folder.resolve("stale.txt")).doesNotExist();
        assertThat(Files.readString(folder.resolve(LetterRepository.SOURCE_TEXT_FILE))).isEqualTo("Lieber Hans,");
        assertThat(Files.readString(folder.resolve(LetterRepository.TEXT_FILE))).isEqualTo("Lieber Hans,");
        assertThat(objectMapper.readTree(folder.resolve(LetterRepository.METADATA_FILE).toFile())
            .path("source_files").get(0).asText()).isEqualTo("german_output/A_german.txt");
    }

    @ParameterizedTest
    @ValueSource(strings = {"../german_output", "..", ".", "sub/../../german_output"})
    @DisplayName("Should refuse folder names outside the letters directory without deleting anything")
    void shouldRejectEscapingFolderNames(String folderName) throws IOException {
        Path lettersDir = Files.createDirectories(workDir.resolve("letters"));
        Path pages = Files.createDirectories(workDir.resolve("german_output"));
        Files.writeString(pages.resolve("A_german.txt"), "Lieber Hans,");
        Files.writeString(lettersDir.resolve("llm_grouping.json"), "{}");

        assertThatThrownBy(() -> repository.save(lettersDir, letter(folderName)))
            .isInstanceOf(LetterWriteException.class)
            .hasMessageContaining(folderName);

        assertThat(pages.resolve("A_german.txt")).exists();
        assertThat(lettersDir.resolve("llm_grouping.json")).exists();
    }

    @Test
    @DisplayName("Should refuse an absolute folder name")
    void shouldRejectAbsoluteFolderName() throws IOException {
        Path lettersDir = Files.createDirectories(workDir.resolve("letters"));
        Path outside = Files.createDirectories(workDir.resolve("outside"));
        Files.writeString(outside.resolve("keep.txt"), "keep");

        assertThatThrownBy(() -> repository.save(lettersDir, letter(outside.toAbsolutePath().toString())))
            .isInstanceOf(LetterWriteException.class);

        assertThat(outside.resolve("keep.txt")).exists();
    }
}
