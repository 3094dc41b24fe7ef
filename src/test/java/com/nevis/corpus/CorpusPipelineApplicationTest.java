package com.nevis.corpus;

import com.nevis.corpus.service.CollaboratorClient;
import com.nevis.corpus.service.LetterPipelineService;
import com.nevis.corpus.worker.SummaryRefreshWorker;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
    "app.gemini.api-key=test-key",
    "app.pipeline.stages=letters"
})
class CorpusPipelineApplicationTest {

    @TempDir
    static Path baseDir;

    @DynamicPropertySource
    static void pipelineProperties(DynamicPropertyRegistry registry) {
        registry.add("app.pipeline.base-dir", () -> baseDir.toString());
    }

    @Autowired
    private ApplicationContext context;

    @Test
    void shouldWireThePipelineWithoutWatchMode() {
        assertThat(context.getBean(CollaboratorClient.class)).isNotNull();
        assertThat(context.getBean(LetterPipelineService.class)).isNotNull();
        assertThat(context.getBeanNamesForType(SummaryRefreshWorker.class)).isEmpty();
    }
}
