package com.nevis.corpus.service;

import com.nevis.corpus.config.PipelineOptions;
import com.nevis.corpus.exception.CollaboratorException;
import com.nevis.corpus.exception.MalformedResponseException;
import com.nevis.corpus.model.GroupingProposal;
import com.nevis.corpus.model.Letter;
import com.nevis.corpus.model.Page;
import com.nevis.corpus.model.ReconciledGroup;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.util.List;

/**
 * Letters stage: optional OCR, page loading, grouping, reconciliation and assembly.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class LetterPipelineService {

    private final PageTranscriptionService transcriptionService;
    private final PageLoader pageLoader;
    private final GroupingService groupingService;
    private final GroupingReconciler reconciler;
    private final LetterAssembler assembler;

    public List<Letter> run(PipelineOptions options) {
        if (options.runOcr()) {
            if (options.imagesDir() == null || !Files.isDirectory(options.imagesDir())) {
                log.warn("--run-ocr requires an existing images directory (got {}); skipping letters stage", options.imagesDir());
                return List.of();
            }
            createDirectories(options);
            int transcribed = transcriptionService.transcribeMissing(options.imagesDir(), options.textDir());
            log.info("Transcribed {} missing pages from {}", transcribed, options.imagesDir());
        }

        if (!Files.isDirectory(options.textDir())) {
            log.warn("Page text directory not found: {}; skipping letters stage", options.textDir());
            return List.of();
        }

        List<Page> pages = pageLoader.loadPages(options.textDir(), options.translationDir());
        if (pages.isEmpty()) {
            log.warn("No page text files found in {}; skipping letters stage", options.textDir());
            return List.of();
        }

        GroupingProposal proposal;
        try {
            proposal = groupingService.proposeGrouping(
                pages, options.lettersDir(), options.reuseGrouping(), options.saveInput());
        } catch (CollaboratorException | MalformedResponseException e) {
            log.error("Grouping failed, no letters assembled: {}", e.getMessage());
            return List.of();
        }

        List<ReconciledGroup> groups = reconciler.reconcile(proposal, pages);
        return assembler.assembleAll(groups, options.lettersDir());
    }

    private static void createDirectories(PipelineOptions options) {
        try {
            Files.createDirectories(options.textDir());
            Files.createDirectories(options.lettersDir());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create pipeline directories", e);
        }
    }
}
