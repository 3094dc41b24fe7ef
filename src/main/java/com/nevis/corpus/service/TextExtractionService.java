package com.nevis.corpus.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.nevis.corpus.exception.CollaboratorException;
import com.nevis.corpus.exception.CorpusReadException;
import com.nevis.corpus.exception.MalformedResponseException;
import com.nevis.corpus.infra.ErrorLogWriter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Text stage: structured extraction of every plain-text file under the input directory.
 * Each result is stored as {@code <stem>_extraction.json} next to its source.
 */
@Service
@Slf4j
public class TextExtractionService {

    public static final String EXTRACTION_SUFFIX = "_extraction.json";
    public static final String ERROR_SUFFIX = "_extraction_error.log";
    public static final String COMBINED_FILE = "text_extractions.json";

    static final int RAW_PREVIEW_LIMIT = 500;

    static final String EXTRACTION_PROMPT =
        """
            You are analyzing a text file from House Oversight Committee documentation.

            TASK: Extract and structure the content of this text file.

            REQUIREMENTS:
            1. CONTENT EXTRACTION:
               - Extract all text content preserving structure
               - Identify document sections or parts
               - Preserve paragraph breaks and line structure

            2. CONTEXT UNDERSTANDING:
               - Determine document type (conversation, transcript, article, memo, etc.)
               - Identify participants or speakers if applicable
               - Note time period or dates mentioned
               - Identify main topics or themes

            3. ENTITY EXTRACTION:
               - Extract all dates, names of people and organizations, locations and addresses
               - Extract document references or file numbers
               - Extract key events or actions

            OUTPUT FORMAT (STRICT JSON ONLY - NO MARKDOWN, NO CODE BLOCKS, NO EXPLANATIONS):
            {
              "file_name": "<filename>",
              "content": {
                "full_text": "<complete_text_content>",
                "sections": [
                  {"section_index": <number>, "section_type": "<header|paragraph|list|quote|etc>", "text": "<section_text>"}
                ]
              },
              "metadata": {
                "document_type": "<type>",
                "participants": ["<name1>", ...],
                "date_range": {"earliest": "<date_or_null>", "latest": "<date_or_null>"},
                "file_references": ["<file_number>", ...]
              },
              "entities": {
                "people": ["<name1>", ...],
                "organizations": ["<org1>", ...],
                "locations": ["<loc1>", ...],
                "dates": ["<date1>", ...],
                "events": ["<event1>", ...]
              },
              "themes": ["<theme1>", ...],
              "confidence": 0.0-1.0,
              "notes": "<any_observations>"
            }

            CRITICAL RULES:
            - Output ONLY valid JSON. Do not wrap in markdown code blocks.
            - Extract text exactly as it appears. Do not summarize or rewrite content.
            - Note any unclear or damaged sections.
            - Start your response with { and end with }""";

    private final CollaboratorClient collaboratorClient;
    private final ModelJsonExtractor jsonExtractor;
    private final ReferenceIdExtractor referenceIdExtractor;
    private final ErrorLogWriter errorLogWriter;
    private final ObjectMapper objectMapper;
    private final String modelName;
    private final Clock clock;

    @Autowired
    public TextExtractionService(CollaboratorClient collaboratorClient,
                                 ModelJsonExtractor jsonExtractor,
                                 ReferenceIdExtractor referenceIdExtractor,
                                 ErrorLogWriter errorLogWriter,
                                 ObjectMapper objectMapper,
                                 @Value("${app.gemini.model:gemini-3-flash-preview}") String modelName) {
        this(collaboratorClient, jsonExtractor, referenceIdExtractor, errorLogWriter, objectMapper, modelName,
            Clock.systemUTC());
    }

    TextExtractionService(CollaboratorClient collaboratorClient,
                          ModelJsonExtractor jsonExtractor,
                          ReferenceIdExtractor referenceIdExtractor,
                          ErrorLogWriter errorLogWriter,
                          ObjectMapper objectMapper,
                          String modelName,
                          Clock clock) {
        this.collaboratorClient = collaboratorClient;
        this.jsonExtractor = jsonExtractor;
        this.referenceIdExtractor = referenceIdExtractor;
        this.errorLogWriter = errorLogWriter;
        this.objectMapper = objectMapper;
        this.modelName = modelName;
        this.clock = clock;
    }

    public List<ObjectNode> extractAll(Path inputDir, Path outputDir, boolean skipExisting) {
        List<Path> files = listTextFiles(inputDir);
        if (files.isEmpty()) {
            log.warn("No text files found in {}", inputDir);
            return List.of();
        }
        log.info("Found {} text file(s) in {}", files.size(), inputDir);

        List<ObjectNode> extractions = new ArrayList<>();
        for (int i = 0; i < files.size(); i++) {
            Path file = files.get(i);
            Path target = extractionFileOf(file);
            if (skipExisting && Files.isRegularFile(target)) {
                ObjectNode existing = readExisting(target);
                if (existing != null) {
                    log.debug("Reusing existing extraction {}", target);
                    extractions.add(existing);
                    continue;
                }
            }
            log.info("[{}/{}] Extracting: {}", i + 1, files.size(), inputDir.relativize(file));
            extractions.add(extract(file, inputDir));
        }

        writeCombined(outputDir, extractions);
        return extractions;
    }

    /**
     * Extracts one file and saves the result next to it. Failures produce a fallback document
     * carrying an {@code error} field instead of an exception.
     */
    public ObjectNode extract(Path file, Path inputDir) {
        String fileName = file.getFileName().toString();
        String text;
        try {
            text = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.error("Failed to read {}: {}", file, e.getMessage());
            ObjectNode unreadable = objectMapper.createObjectNode();
            unreadable.put("file_name", fileName);
            unreadable.put("error", "Failed to read file: " + e.getMessage());
            return unreadable;
        }

        ObjectNode result = requestExtraction(file, inputDir, text);
        enrich(result, file, inputDir);
        save(extractionFileOf(file), result);
        return result;
    }

    private ObjectNode requestExtraction(Path file, Path inputDir, String text) {
        String raw;
        try {
            raw = collaboratorClient.sendText(EXTRACTION_PROMPT + "\n\n--- TEXT FILE ---\n" + text + "\n--- END TEXT FILE ---");
        } catch (CollaboratorException e) {
            String message = "LLM request failed: " + e.getMessage();
            errorLogWriter.write(errorFileOf(file), message, Map.of());
            log.warn("{} for {}. Error saved to {}", message, file.getFileName(), errorFileOf(file).getFileName());
            return fallback(file, inputDir, text, message, "");
        }

        try {
            return jsonExtractor.parseObject(raw);
        } catch (MalformedResponseException e) {
            Map<String, String> sections = new LinkedHashMap<>();
            sections.put("RAW RESPONSE (first 2000 chars):", e.getRawResponse());
            sections.put("ATTEMPTED JSON TEXT:", e.getAttemptedJson());
            errorLogWriter.write(errorFileOf(file), "JSON Parse Error: " + e.getMessage(), sections);
            log.warn("Failed to parse JSON for {}. Error saved to {}", file.getFileName(), errorFileOf(file).getFileName());
            return fallback(file, inputDir, text, "Failed to parse LLM response: " + e.getMessage(), raw);
        }
    }

    private ObjectNode fallback(Path file, Path inputDir, String text, String error, String raw) {
        ObjectNode fallback = objectMapper.createObjectNode();
        fallback.put("file_name", file.getFileName().toString());
        fallback.put("file_path", relativePathOf(file, inputDir));
        fallback.putObject("content").put("full_text", text);
        fallback.put("error", error);
        if (raw != null && !raw.isEmpty()) {
            fallback.put("raw_response_preview", raw.length() <= RAW_PREVIEW_LIMIT ? raw : raw.substring(0, RAW_PREVIEW_LIMIT));
        }
        return fallback;
    }

    private void enrich(ObjectNode result, Path file, Path inputDir) {
        String fileName = file.getFileName().toString();
        if (!result.has("file_name")) {
            result.put("file_name", fileName);
        }
        if (!result.has("file_path")) {
            result.put("file_path", relativePathOf(file, inputDir));
        }
        if (!result.has("house_oversight_id")) {
            referenceIdExtractor.canonicalId(fileName).ifPresent(id -> result.put("house_oversight_id", id));
        }
        ObjectNode metadata = result.putObject("processing_metadata");
        metadata.put("processed_at", Instant.now(clock).toString());
        metadata.put("model", modelName);
    }

    private ObjectNode readExisting(Path target) {
        try {
            JsonNode node = objectMapper.readTree(target.toFile());
            return node != null && node.isObject() ? (ObjectNode) node : null;
        } catch (IOException e) {
            log.warn("Existing extraction {} is unreadable, extracting again: {}", target, e.getMessage());
            return null;
        }
    }

    private void save(Path target, JsonNode result) {
        try {
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(target.toFile(), result);
        } catch (IOException e) {
            log.error("Could not save extraction {}: {}", target, e.getMessage());
        }
    }

    private void writeCombined(Path outputDir, List<ObjectNode> extractions) {
        Path combined = outputDir.resolve(COMBINED_FILE);
        ArrayNode array = objectMapper.createArrayNode();
        extractions.forEach(array::add);
        try {
            Files.createDirectories(outputDir);
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(combined.toFile(), array);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write " + combined, e);
        }
        log.info("Saved {} extractions to {}", extractions.size(), combined);
    }

    static Path extractionFileOf(Path file) {
        return file.resolveSibling(stemOf(file) + EXTRACTION_SUFFIX);
    }

    static Path errorFileOf(Path file) {
        return file.resolveSibling(stemOf(file) + ERROR_SUFFIX);
    }

    private static String relativePathOf(Path file, Path inputDir) {
        Path anchor = inputDir.toAbsolutePath().normalize().getParent();
        Path absolute = file.toAbsolutePath().normalize();
        Path relative = anchor == null ? absolute : anchor.relativize(absolute);
        return relative.toString().replace('\\', '/');
    }

    private static String stemOf(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private static List<Path> listTextFiles(Path inputDir) {
        if (!Files.isDirectory(inputDir)) {
            throw new CorpusReadException(inputDir, "Text input directory does not exist");
        }
        return TolerantFileCollector.collect(inputDir,
            path -> path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".txt")
                && !stemOf(path).toLowerCase(Locale.ROOT).contains("_extraction_error"),
            dir -> true);
    }
}
