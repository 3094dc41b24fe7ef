package com.nevis.corpus.service;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ReferenceIdExtractorTest {

    private final ReferenceIdExtractor extractor = new ReferenceIdExtractor();

    @Test
    void shouldPreferCanonicalIdentifiers() {
        assertThat(extractor.extract("HOUSE_OVERSIGHT_010477_german.txt")).containsExactly("010477");
        assertThat(extractor.extract("house-oversight-2024_scan_9999.txt")).containsExactly("2024");
    }

    @Test
    void shouldFallBackToLongDigitRuns() {
        assertThat(extractor.extract("scan_20240101_page_12.txt")).containsExactly("20240101");
        assertThat(extractor.extract("page_12.txt")).isEmpty();
    }

    @Test
    void shouldDeduplicateAcrossSourcesInFirstSeenOrder() {
        List<String> ids = extractor.extractAll(List.of(
            "german_output/HOUSE_OVERSIGHT_000200_german.txt",
            "german_output/HOUSE_OVERSIGHT_000100_german.txt",
            "other/HOUSE_OVERSIGHT_000200_text.txt"
        ));

        assertThat(ids).containsExactly("000200", "000100");
    }

    @Test
    void shouldUseFileNameOnly() {
        assertThat(extractor.extractAll(List.of("batch_123456/page.txt"))).isEmpty();
    }

    @Test
    void shouldExposeCanonicalIdOnly() {
        assertThat(extractor.canonicalId("HOUSE_OVERSIGHT_012345.txt")).contains("012345");
        assertThat(extractor.canonicalId("scan_20240101.txt")).isEmpty();
    }
}
