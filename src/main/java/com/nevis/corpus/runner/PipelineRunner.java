package com.nevis.corpus.runner;

import com.nevis.corpus.config.PipelineOptions;
import com.nevis.corpus.config.PipelineProperties;
import com.nevis.corpus.model.Letter;
import com.nevis.corpus.model.PipelineStage;
import com.nevis.corpus.service.LetterPipelineService;
import com.nevis.corpus.service.SummaryRefreshService;
import com.nevis.corpus.service.TextExtractionService;
import com.nevis.corpus.service.TranslationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Command line entry point. Runs the selected stages once, in pipeline order.
 * A stage whose input is missing is skipped and the run continues.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class PipelineRunner implements ApplicationRunner {

    private final PipelineProperties properties;
    private final TextExtractionService textExtractionService;
    private final LetterPipelineService letterPipelineService;
    private final TranslationService translationService;
    private final SummaryRefreshService summaryRefreshService;

    @Override
    public void run(ApplicationArguments args) {
        PipelineOptions options = PipelineOptions.resolve(properties, args);
        log.info("Running stages {} with base directory {}", options.stages(), options.baseDir().toAbsolutePath());

        for (PipelineStage stage : PipelineStage.values()) {
            if (!options.runs(stage)) {
                continue;
            }
            try {
                runStage(stage, options);
            } catch (RuntimeException e) {
                log.error("Stage {} failed: {}", stage.name().toLowerCase(), e.getMessage(), e);
            }
        }
        log.info("Pipeline run finished");
    }

    void runStage(PipelineStage stage, PipelineOptions options) {
        switch (stage) {
            case TEXT -> {
                if (isMissing(options.textInputDir(), "text")) {
                    return;
                }
                List<?> extractions = textExtractionService.extractAll(
                    options.textInputDir(), options.outputDir(), options.skipExisting());
                log.info("Text stage complete: {} extraction(s)", extractions.size());
            }
            case LETTERS -> {
                List<Letter> letters = letterPipelineService.run(options);
                log.info("Letters stage complete: {} letter(s) written to {}", letters.size(), options.lettersDir());
            }
            case TRANSLATE -> {
                if (isMissing(options.lettersDir(), "translate")) {
                    return;
                }
                int translated = translationService.translateAll(options.lettersDir(), options.forceTranslate());
                log.info("Translate stage complete: {} letter(s) translated", translated);
            }
            case SUMMARY -> summaryRefreshService.refresh(options)
                .ifPresent(summary -> log.info("Summary stage complete ({} chars)", summary.length()));
        }
    }

    private static boolean isMissing(Path dir, String stage) {
        if (dir == null || !Files.isDirectory(dir)) {
            log.warn("Input directory for stage {} not found: {}; skipping", stage, dir);
            return true;
        }
        return false;
    }
}
