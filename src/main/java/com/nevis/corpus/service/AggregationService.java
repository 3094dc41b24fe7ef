package com.nevis.corpus.service;

import com.nevis.corpus.model.AggregatedSnapshot;

import java.nio.file.Path;
import java.util.List;

public interface AggregationService {
    AggregatedSnapshot aggregate(Path baseDir, List<String> excludedSegments, int sampleLimit);
}
