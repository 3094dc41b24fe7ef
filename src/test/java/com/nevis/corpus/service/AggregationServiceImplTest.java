package com.nevis.corpus.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.nevis.corpus.exception.CorpusReadException;
import com.nevis.corpus.model.AggregatedSnapshot;
import com.nevis.corpus.model.ExplosiveFinding;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

class AggregationServiceImplTest {

    private static final List<String> EXCLUDED = List.of("PIPELINE", ".git");

    private final AggregationServiceImpl aggregationService = new AggregationServiceImpl(new ObjectMapper());

    @TempDir
    Path baseDir;

    private void write(String relative, String json) throws IOException {
        Path file = baseDir.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, json);
    }

    @Test
    @DisplayName("Should deduplicate entities across documents and sections")
    void shouldDeduplicateEntities() throws IOException {
        write("IMAGES/a.json", """
            {"structured_data": {"people": ["Jane Doe", " "], "organizations": ["ACME"], "dates": ["1999-01-01"]}}
            """);
        write("TEXT/b_extraction.json", """
            {"entities": {"people": ["Jane Doe", 42], "locations": ["Paris"]}, "document_metadata": {"date": "2001-02-03"}}
            """);

        AggregatedSnapshot snapshot = aggregationService.aggregate(baseDir, EXCLUDED, 20);

        assertThat(snapshot.namedIndividuals()).containsExactly("Jane Doe");
        assertThat(snapshot.organizations()).containsExactly("ACME");
        assertThat(snapshot.locations()).containsExactly("Paris");
        assertThat(snapshot.dates()).containsExactly("1999-01-01", "2001-02-03");
        assertThat(snapshot.totalDocuments()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should return an empty snapshot for a corpus without JSON files")
    void shouldHandleEmptyCorpus() throws IOException {
        Files.writeString(baseDir.resolve("notes.txt"), "no json here");

        AggregatedSnapshot snapshot = aggregationService.aggregate(baseDir, EXCLUDED, 20);

        assertThat(snapshot.isEmpty()).isTrue();
        assertThat(snapshot.documentTypeCounts()).isEmpty();
    }

    @Test
    @DisplayName("Should skip malformed files and excluded directories")
    void shouldSkipMalformedAndExcluded() throws IOException {
        write("IMAGES/good.json", "{\"structured_data\": {\"people\": [\"Jane Doe\"]}}");
        write("IMAGES/broken.json", "{\"structured_data\": ");
        write("PIPELINE/output/text_extractions.json", "{\"entities\": {\"people\": [\"Hidden\"]}}");
        write(".git/config.json", "{}");

        AggregatedSnapshot snapshot = aggregationService.aggregate(baseDir, EXCLUDED, 20);

        assertThat(snapshot.totalDocuments()).isEqualTo(1);
        assertThat(snapshot.namedIndividuals()).containsExactly("Jane Doe");
    }

    @Test
    @DisplayName("Should skip documents with trailing content after the JSON value")
    void shouldSkipTrailingGarbage() throws IOException {
        write("IMAGES/good.json", "{\"structured_data\": {\"people\": [\"Jane Doe\"]}}");
        write("IMAGES/trailing.json", "{\"a\":1} junk");
        write("IMAGES/two_values.json", "{\"structured_data\": {\"people\": [\"Twice\"]}} {}");

        AggregatedSnapshot snapshot = aggregationService.aggregate(baseDir, EXCLUDED, 20);

        assertThat(snapshot.totalDocuments()).isEqualTo(1);
        assertThat(snapshot.namedIndividuals()).containsExactly("Jane Doe");
    }

    @Test
    @DisplayName("Should fail when the aggregation root does not exist")
    void shouldFailForMissingRoot() {
        assertThatThrownBy(() -> aggregationService.aggregate(baseDir.resolve("missing"), EXCLUDED, 20))
            .isInstanceOf(CorpusReadException.class);
    }

    @Test
    @DisplayName("Should classify documents and count each once")
    void shouldClassifyDocuments() throws IOException {
        write("IMAGES/scan.json", "{}");
        write("TEXT/memo_extraction.json", "{}");
        write("letters/X L0001/meta.json", "{\"id\": \"L0001\"}");
        write("NATIVES/sheet.json", "{\"document_type\": \"spreadsheet\"}");

        AggregatedSnapshot snapshot = aggregationService.aggregate(baseDir, EXCLUDED, 20);

        assertThat(snapshot.documentTypeCounts()).containsExactly(
            entry("image_analysis", 1),
            entry("letter", 1),
            entry("spreadsheet", 1),
            entry("text_extraction", 1));
    }

    @Test
    @DisplayName("Should cap samples and collect notes as findings")
    void shouldCapSamplesAndCollectNotes() throws IOException {
        write("a.json", "{\"notes\": \"Wire transfer to offshore account\"}");
        write("b.json", "{\"notes\": \"   \"}");
        write("c.json", "{\"notes\": [\"flagged\"]}");

        AggregatedSnapshot snapshot = aggregationService.aggregate(baseDir, EXCLUDED, 2);

        assertThat(snapshot.samples()).hasSize(2);
        assertThat(snapshot.samples().get(0).file()).isEqualTo("a.json");
        assertThat(snapshot.explosiveFindings()).extracting(ExplosiveFinding::file).containsExactly("a.json", "c.json");
        assertThat(snapshot.explosiveFindings().get(1).note()).isEqualTo("[\"flagged\"]");
    }
}
