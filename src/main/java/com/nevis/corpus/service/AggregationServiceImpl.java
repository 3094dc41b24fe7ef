package com.nevis.corpus.service;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.nevis.corpus.exception.CorpusReadException;
import com.nevis.corpus.model.AggregatedSnapshot;
import com.nevis.corpus.model.DocumentSample;
import com.nevis.corpus.model.ExplosiveFinding;
import com.nevis.corpus.repository.LetterRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.StreamSupport;

@Service
@Slf4j
@RequiredArgsConstructor
public class AggregationServiceImpl implements AggregationService {

    public static final String TEXT_EXTRACTION_TYPE = "text_extraction";
    public static final String IMAGE_ANALYSIS_TYPE = "image_analysis";
    public static final String LETTER_TYPE = "letter";

    private static final List<String> ENTITY_SECTIONS = List.of("structured_data", "entities");

    private final ObjectMapper objectMapper;

    @Override
    public AggregatedSnapshot aggregate(Path baseDir, List<String> excludedSegments, int sampleLimit) {
        ObjectReader strictReader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
        List<Path> files = listJsonFiles(baseDir, Set.copyOf(excludedSegments));
        log.info("Found {} JSON files to aggregate under {}", files.size(), baseDir);

        Accumulator accumulator = new Accumulator(sampleLimit);
        for (Path file : files) {
            JsonNode data;
            try (InputStream in = Files.newInputStream(file)) {
                data = strictReader.readTree(in);
            } catch (IOException e) {
                log.warn("Could not process {}: {}", file.getFileName(), e.getMessage());
                continue;
            }
            if (data == null || data.isMissingNode()) {
                log.warn("Could not process {}: empty document", file.getFileName());
                continue;
            }
            accumulator.add(file.getFileName().toString(), data);
        }

        AggregatedSnapshot snapshot = accumulator.freeze();
        log.info("Aggregated {} documents: {} individuals, {} organizations, {} locations, {} dates",
            snapshot.totalDocuments(), snapshot.namedIndividuals().size(), snapshot.organizations().size(),
            snapshot.locations().size(), snapshot.dates().size());
        return snapshot;
    }

    private static List<Path> listJsonFiles(Path baseDir, Set<String> excludedSegments) {
        if (!Files.isDirectory(baseDir)) {
            throw new CorpusReadException(baseDir, "Aggregation root is not a directory");
        }
        return TolerantFileCollector.collect(baseDir,
            path -> path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".json")
                && !isExcluded(baseDir.relativize(path), excludedSegments),
            dir -> !isExcluded(baseDir.relativize(dir), excludedSegments));
    }

    private static boolean isExcluded(Path relative, Set<String> excludedSegments) {
        return StreamSupport.stream(relative.spliterator(), false)
            .map(Path::toString)
            .anyMatch(excludedSegments::contains);
    }

    static String classify(String fileName, JsonNode data) {
        JsonNode explicit = data.get("document_type");
        if (explicit != null) {
            return explicit.isTextual() ? explicit.textValue() : explicit.toString();
        }
        if (fileName.contains("_extraction")) {
            return TEXT_EXTRACTION_TYPE;
        }
        if (LetterRepository.METADATA_FILE.equals(fileName)) {
            return LETTER_TYPE;
        }
        return IMAGE_ANALYSIS_TYPE;
    }

    /**
     * Mutable state of a single aggregation run.
     */
    private static final class Accumulator {
        private final int sampleLimit;
        private final Set<String> individuals = new HashSet<>();
        private final Set<String> organizations = new HashSet<>();
        private final Set<String> locations = new HashSet<>();
        private final Set<String> dates = new HashSet<>();
        private final Map<String, Integer> typeCounts = new TreeMap<>();
        private final List<DocumentSample> samples = new ArrayList<>();
        private final List<ExplosiveFinding> findings = new ArrayList<>();
        private int totalDocuments;

        Accumulator(int sampleLimit) {
            this.sampleLimit = sampleLimit;
        }

        void add(String fileName, JsonNode data) {
            totalDocuments++;
            if (!data.isObject()) {
                return;
            }

            for (String section : ENTITY_SECTIONS) {
                JsonNode entities = data.path(section);
                if (!entities.isObject()) {
                    continue;
                }
                addStrings(entities.path("people"), individuals);
                addStrings(entities.path("organizations"), organizations);
                addStrings(entities.path("locations"), locations);
                addStrings(entities.path("dates"), dates);
            }

            JsonNode date = data.path("document_metadata").path("date");
            if (date.isValueNode() && !date.isNull() && !date.asText().isBlank()) {
                dates.add(date.asText().strip());
            }

            noteOf(data.get("notes")).ifPresent(note -> findings.add(new ExplosiveFinding(fileName, note)));

            typeCounts.merge(classify(fileName, data), 1, Integer::sum);

            if (samples.size() < sampleLimit) {
                samples.add(new DocumentSample(fileName, data));
            }
        }

        private static void addStrings(JsonNode values, Set<String> target) {
            if (!values.isArray()) {
                return;
            }
            for (JsonNode value : values) {
                if (value.isTextual() && !value.textValue().isBlank()) {
                    target.add(value.textValue().strip());
                }
            }
        }

        private static Optional<String> noteOf(JsonNode notes) {
            if (notes == null || notes.isNull()) {
                return Optional.empty();
            }
            if (notes.isTextual()) {
                return notes.textValue().isBlank()
                    ? Optional.empty()
                    : Optional.of(notes.textValue());
            }
            if (notes.isContainerNode()) {
                return notes.isEmpty() ? Optional.empty() : Optional.of(notes.toString());
            }
            return Optional.of(notes.asText());
        }

        AggregatedSnapshot freeze() {
            return new AggregatedSnapshot(
                sorted(individuals),
                sorted(organizations),
                sorted(locations),
                sorted(dates),
                Collections.unmodifiableMap(new TreeMap<>(typeCounts)),
                totalDocuments,
                List.copyOf(samples),
                List.copyOf(findings)
            );
        }

        private static List<String> sorted(Set<String> values) {
            return values.stream().sorted().toList();
        }
    }
}
