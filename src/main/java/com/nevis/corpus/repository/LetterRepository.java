package com.nevis.corpus.repository;

import com.nevis.corpus.model.Letter;

import java.nio.file.Path;

public interface LetterRepository {

    String METADATA_FILE = "meta.json";
    String SOURCE_TEXT_FILE = "de.txt";
    String TEXT_FILE = "text.txt";

    /**
     * Replaces the letter's folder under {@code lettersDir} with fresh metadata and text files.
     *
     * @throws com.nevis.corpus.exception.LetterWriteException when the folder cannot be written
     */
    void save(Path lettersDir, Letter letter);
}
