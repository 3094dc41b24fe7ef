package com.nevis.corpus.service;

import com.nevis.corpus.exception.LetterWriteException;
import com.nevis.corpus.model.Letter;
import com.nevis.corpus.model.Page;
import com.nevis.corpus.model.ReconciledGroup;
import com.nevis.corpus.repository.LetterRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

@Component
@Slf4j
@RequiredArgsConstructor
public class LetterAssembler {

    private final ReferenceIdExtractor referenceIdExtractor;
    private final LetterRepository letterRepository;

    /**
     * Builds and persists every letter. A letter whose folder cannot be written is logged and skipped;
     * the returned list holds the letters that were written.
     */
    public List<Letter> assembleAll(List<ReconciledGroup> groups, Path lettersDir) {
        String collectionName = collectionNameOf(lettersDir);
        List<Letter> written = new ArrayList<>(groups.size());

        for (int i = 0; i < groups.size(); i++) {
            Letter letter = assemble(groups.get(i), i + 1, collectionName);
            try {
                letterRepository.save(lettersDir, letter);
                written.add(letter);
                log.debug("Wrote letter {} ({} pages)", letter.folderName(), letter.pageKeys().size());
            } catch (LetterWriteException e) {
                log.error("Letter {}: {}", letter.folderName(), e.getMessage(), e);
            }
        }

        log.info("Assembled {} of {} letters under {}", written.size(), groups.size(), lettersDir);
        return written;
    }

    public Letter assemble(ReconciledGroup group, int position, String collectionName) {
        String id = GroupingService.isSafeFolderId(group.group().id())
            ? group.group().id()
            : String.format("L%04d", position);

        String folderName = collectionName == null || collectionName.isBlank()
            ? id
            : (collectionName + " " + id).strip();

        // pages are joined as-is, downstream readers depend on the exact source text
        String text = group.pages().stream()
            .map(Page::text)
            .collect(Collectors.joining());

        List<String> sourceFiles = group.pages().stream()
            .map(Page::sourcePath)
            .filter(path -> path != null && !path.isEmpty())
            .distinct()
            .toList();

        return new Letter(
            id,
            folderName,
            group.pages().stream().map(Page::key).toList(),
            text,
            sourceFiles,
            referenceIdExtractor.extractAll(sourceFiles),
            group.group()
        );
    }

    /**
     * Name of the directory that holds the letters directory, or an empty string when there is none.
     */
    public static String collectionNameOf(Path lettersDir) {
        Path parent = lettersDir.normalize().getParent();
        if (parent == null || parent.getFileName() == null) {
            return "";
        }
        String name = parent.getFileName().toString();
        return ".".equals(name) ? "" : name;
    }
}
