package com.nevis.corpus.worker;

import com.nevis.corpus.config.PipelineOptions;
import com.nevis.corpus.config.PipelineProperties;
import com.nevis.corpus.service.SummaryRefreshService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.pipeline.watch.enabled", havingValue = "true")
public class SummaryRefreshWorker {

    private final PipelineProperties properties;
    private final SummaryRefreshService summaryRefreshService;

    @Scheduled(fixedDelayString = "${app.pipeline.watch.interval-ms:300000}",
        initialDelayString = "${app.pipeline.watch.interval-ms:300000}")
    public void refreshSummary() {
        log.debug("Refreshing strategic summary...");
        try {
            summaryRefreshService.refresh(PipelineOptions.defaults(properties));
        } catch (RuntimeException e) {
            log.error("Scheduled summary refresh failed: {}", e.getMessage(), e);
        }
    }
}
