package com.nevis.corpus.model;

import java.util.List;
import java.util.Map;

/**
 * Frozen result of one aggregation run. Entity lists are sorted and duplicate-free; type counts are
 * per document.
 */
public record AggregatedSnapshot(
    List<String> namedIndividuals,
    List<String> organizations,
    List<String> locations,
    List<String> dates,
    Map<String, Integer> documentTypeCounts,
    int totalDocuments,
    List<DocumentSample> samples,
    List<ExplosiveFinding> explosiveFindings
) {
    public static AggregatedSnapshot empty() {
        return new AggregatedSnapshot(List.of(), List.of(), List.of(), List.of(), Map.of(), 0, List.of(), List.of());
    }

    public boolean isEmpty() {
        return totalDocuments == 0;
    }
}
