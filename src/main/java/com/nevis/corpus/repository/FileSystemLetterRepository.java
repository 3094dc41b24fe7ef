package com.nevis.corpus.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.nevis.corpus.exception.LetterWriteException;
import com.nevis.corpus.model.Letter;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

@Repository
@RequiredArgsConstructor
public class FileSystemLetterRepository implements LetterRepository {

    private final ObjectMapper objectMapper;

    @Override
    public void save(Path lettersDir, Letter letter) {
        Path base = lettersDir.toAbsolutePath().normalize();
        Path folder = base.resolve(letter.folderName()).normalize();
        if (!base.equals(folder.getParent())) {
            throw new LetterWriteException(letter.folderName(), "folder must be a direct child of " + base);
        }
        try {
            FileSystemUtils.deleteRecursively(folder);
            Files.createDirectories(folder);

            String metadata = objectMapper.writerWithDefaultPrettyPrinter()
                .writeValueAsString(metadataOf(letter));
            Files.writeString(folder.resolve(METADATA_FILE), metadata, StandardCharsets.UTF_8);

            Files.writeString(folder.resolve(SOURCE_TEXT_FILE), letter.concatenatedText(), StandardCharsets.UTF_8);
            Files.writeString(folder.resolve(TEXT_FILE), letter.concatenatedText(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new LetterWriteException(letter.folderName(), e);
        }
    }

    /**
     * The proposed group as received, plus provenance.
     */
    ObjectNode metadataOf(Letter letter) {
        ObjectNode metadata = letter.proposedGroup().raw() != null
            ? letter.proposedGroup().raw().deepCopy()
            : objectMapper.createObjectNode();
        metadata.set("source_files", arrayOf(letter.sourceFiles()));
        metadata.set("reference_ids", arrayOf(letter.referenceIds()));
        return metadata;
    }

    private ArrayNode arrayOf(List<String> values) {
        ArrayNode array = objectMapper.createArrayNode();
        values.forEach(array::add);
        return array;
    }
}
