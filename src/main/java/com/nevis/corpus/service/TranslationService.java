package com.nevis.corpus.service;

import com.nevis.corpus.exception.CollaboratorException;
import com.nevis.corpus.infra.ErrorLogWriter;
import com.nevis.corpus.repository.LetterRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Translates assembled letters into English, one {@code en.txt} per letter folder.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TranslationService {

    public static final String TRANSLATION_FILE = "en.txt";
    public static final String ERROR_FILE = "translation_error.log";

    static final String TRANSLATION_PROMPT =
        """
            Translate the following House Oversight Committee document page(s) to natural, idiomatic English.
            Preserve meaning, dates, names, and paragraph breaks.
            Do not add headings, numbering, labels, or commentary.
            Output only the translated text.

            --- BEGIN SOURCE TEXT ---
            %s
            --- END SOURCE TEXT ---""";

    private final CollaboratorClient collaboratorClient;
    private final ErrorLogWriter errorLogWriter;

    /**
     * @return number of letters for which a translation was requested
     */
    public int translateAll(Path lettersDir, boolean force) {
        List<Path> letterDirs = listLetterDirs(lettersDir);
        if (letterDirs.isEmpty()) {
            log.info("No letter directories found in {}", lettersDir);
            return 0;
        }

        int translated = 0;
        for (Path letterDir : letterDirs) {
            Optional<Path> source = sourceTextOf(letterDir);
            if (source.isEmpty()) {
                continue;
            }
            Path target = letterDir.resolve(TRANSLATION_FILE);
            if (Files.exists(target) && !force) {
                log.debug("Skip existing: {}", target);
                continue;
            }

            try {
                String sourceText = read(source.get()).strip();
                if (sourceText.isEmpty()) {
                    write(target, "");
                    continue;
                }

                log.info("Translating {} ({} chars)", letterDir.getFileName(), sourceText.length());
                translated++;
                String english = collaboratorClient.sendText(TRANSLATION_PROMPT.formatted(sourceText)).strip();
                write(target, english + "\n");
            } catch (CollaboratorException | UncheckedIOException e) {
                log.error("Translation error for {}: {}", letterDir.getFileName(), e.getMessage());
                errorLogWriter.write(letterDir.resolve(ERROR_FILE),
                    "Translation failed for " + letterDir.getFileName() + ": " + e.getMessage(), Map.of());
            }
        }
        return translated;
    }

    static Optional<Path> sourceTextOf(Path letterDir) {
        Path primary = letterDir.resolve(LetterRepository.SOURCE_TEXT_FILE);
        if (Files.isRegularFile(primary)) {
            return Optional.of(primary);
        }
        Path alternative = letterDir.resolve(LetterRepository.TEXT_FILE);
        return Files.isRegularFile(alternative) ? Optional.of(alternative) : Optional.empty();
    }

    private static List<Path> listLetterDirs(Path lettersDir) {
        if (!Files.isDirectory(lettersDir)) {
            return List.of();
        }
        try (Stream<Path> entries = Files.list(lettersDir)) {
            return entries
                .filter(Files::isDirectory)
                .filter(dir -> sourceTextOf(dir).isPresent())
                .sorted(Comparator.comparing(Path::toString))
                .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list letters in " + lettersDir, e);
        }
    }

    private static String read(Path file) {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + file, e);
        }
    }

    private static void write(Path file, String content) {
        try {
            Files.writeString(file, content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write " + file, e);
        }
    }
}
