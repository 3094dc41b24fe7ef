package com.nevis.corpus.repository;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Audit and checkpoint files of the grouping round-trip, kept in the letters directory.
 */
public interface GroupingRepository {

    String INPUT_FILE = "llm_grouping_input.txt";
    String RESPONSE_FILE = "llm_grouping.json";
    String ERROR_FILE = "llm_grouping_error.log";

    void saveInput(Path lettersDir, String listing);

    void saveRawResponse(Path lettersDir, String rawResponse);

    Optional<String> findRawResponse(Path lettersDir);
}
