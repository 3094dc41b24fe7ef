package com.nevis.corpus.service;

import com.nevis.corpus.config.PipelineOptions;
import com.nevis.corpus.exception.CollaboratorException;
import com.nevis.corpus.model.GroupingProposal;
import com.nevis.corpus.model.Letter;
import com.nevis.corpus.model.Page;
import com.nevis.corpus.model.PipelineStage;
import com.nevis.corpus.model.ProposedGroup;
import com.nevis.corpus.model.ReconciledGroup;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class LetterPipelineServiceTest {

    @Mock
    private PageTranscriptionService transcriptionService;
    @Mock
    private PageLoader pageLoader;
    @Mock
    private GroupingService groupingService;
    @Mock
    private GroupingReconciler reconciler;
    @Mock
    private LetterAssembler assembler;

    @TempDir
    Path baseDir;

    private LetterPipelineService pipelineService;

    @BeforeEach
    void setUp() {
        pipelineService = new LetterPipelineService(transcriptionService, pageLoader, groupingService, reconciler, assembler);
    }

    private PipelineOptions options(boolean runOcr, Path imagesDir) {
        return new PipelineOptions(baseDir, baseDir.resolve("german_output"), imagesDir, null,
            baseDir.resolve("letters"), baseDir.resolve("TEXT"), baseDir.resolve("PIPELINE/output"),
            EnumSet.of(PipelineStage.LETTERS), false, false, runOcr, false, false, 20, List.of(), "STRATEGIC_SUMMARY.md");
    }

    @Test
    @DisplayName("Should skip the stage when the page directory is missing")
    void shouldSkipWithoutPages() {
        assertThat(pipelineService.run(options(false, null))).isEmpty();

        verifyNoInteractions(pageLoader, groupingService, assembler);
    }

    @Test
    @DisplayName("Should skip OCR and the stage when OCR is requested without images")
    void shouldSkipOcrWithoutImages() {
        assertThat(pipelineService.run(options(true, baseDir.resolve("IMAGES")))).isEmpty();

        verifyNoInteractions(transcriptionService, pageLoader);
    }

    @Test
    @DisplayName("Should run OCR, grouping, reconciliation and assembly in order")
    void shouldRunFullFlow() throws IOException {
        Path images = Files.createDirectories(baseDir.resolve("IMAGES"));
        PipelineOptions options = options(true, images);
        List<Page> pages = List.of(new Page("A", "a", "german_output/A_german.txt", null));
        GroupingProposal proposal = new GroupingProposal(
            List.of(new ProposedGroup("L0001", List.of("A"), null, null, null)), List.of());
        List<ReconciledGroup> groups = List.of(new ReconciledGroup(proposal.letters().get(0), pages, List.of()));
        Letter letter = new Letter("L0001", "L0001", List.of("A"), "a", List.of(), List.of(), proposal.letters().get(0));

        when(pageLoader.loadPages(options.textDir(), null)).thenReturn(pages);
        when(groupingService.proposeGrouping(pages, options.lettersDir(), false, false)).thenReturn(proposal);
        when(reconciler.reconcile(proposal, pages)).thenReturn(groups);
        when(assembler.assembleAll(groups, options.lettersDir())).thenReturn(List.of(letter));

        assertThat(pipelineService.run(options)).containsExactly(letter);
        verify(transcriptionService).transcribeMissing(images, options.textDir());
    }

    @Test
    @DisplayName("Should assemble nothing when grouping fails")
    void shouldStopWhenGroupingFails() throws IOException {
        PipelineOptions options = options(false, null);
        Files.createDirectories(options.textDir());
        List<Page> pages = List.of(new Page("A", "a", "german_output/A_german.txt", null));
        when(pageLoader.loadPages(any(), any())).thenReturn(pages);
        when(groupingService.proposeGrouping(anyList(), any(), anyBoolean(), anyBoolean()))
            .thenThrow(new CollaboratorException("down"));

        assertThat(pipelineService.run(options)).isEmpty();
        verifyNoInteractions(reconciler, assembler);
    }
}
