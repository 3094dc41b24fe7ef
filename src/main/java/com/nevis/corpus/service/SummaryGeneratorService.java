package com.nevis.corpus.service;

import com.nevis.corpus.model.AggregatedSnapshot;

public interface SummaryGeneratorService {
    String generateSummary(AggregatedSnapshot snapshot);
}
