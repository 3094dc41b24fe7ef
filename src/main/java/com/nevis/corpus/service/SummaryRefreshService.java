package com.nevis.corpus.service;

import com.nevis.corpus.config.PipelineOptions;
import com.nevis.corpus.model.AggregatedSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.util.Optional;

/**
 * Summary stage: aggregate the corpus, ask for a strategic summary, publish it.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SummaryRefreshService {

    private final AggregationService aggregationService;
    private final SummaryGeneratorService summaryGeneratorService;
    private final SummaryPublisher summaryPublisher;

    public Optional<String> refresh(PipelineOptions options) {
        if (!Files.isDirectory(options.baseDir())) {
            log.warn("Base directory not found: {}; skipping summary stage", options.baseDir());
            return Optional.empty();
        }

        AggregatedSnapshot snapshot = aggregationService.aggregate(
            options.baseDir(), options.excludedSegments(), options.sampleLimit());
        String summary = summaryGeneratorService.generateSummary(snapshot);
        summaryPublisher.publish(options.baseDir(), options.summaryFile(), summary);
        return Optional.of(summary);
    }
}
