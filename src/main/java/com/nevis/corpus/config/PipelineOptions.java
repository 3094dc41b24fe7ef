package com.nevis.corpus.config;

import com.nevis.corpus.model.PipelineStage;
import org.springframework.boot.ApplicationArguments;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Fully resolved settings of one pipeline run: configured defaults with command line flags applied.
 */
public record PipelineOptions(
    Path baseDir,
    Path textDir,
    Path imagesDir,
    Path translationDir,
    Path lettersDir,
    Path textInputDir,
    Path outputDir,
    Set<PipelineStage> stages,
    boolean saveInput,
    boolean reuseGrouping,
    boolean runOcr,
    boolean forceTranslate,
    boolean skipExisting,
    int sampleLimit,
    List<String> excludedSegments,
    String summaryFile
) {

    public static PipelineOptions defaults(PipelineProperties properties) {
        return resolve(properties, null);
    }

    public static PipelineOptions resolve(PipelineProperties properties, ApplicationArguments args) {
        Path baseDir = Path.of(firstNonBlank(option(args, "base-dir"), properties.baseDir()));

        List<String> stageValues = args != null && args.containsOption("stage")
            ? args.getOptionValues("stage")
            : properties.stages();

        return new PipelineOptions(
            baseDir,
            path(args, baseDir, properties.textDir(), "text-dir", "pages-dir"),
            path(args, baseDir, properties.imagesDir(), "images-dir"),
            path(args, baseDir, properties.translationDir(), "translation-dir"),
            path(args, baseDir, properties.lettersDir(), "letters-dir"),
            path(args, baseDir, properties.textInputDir(), "text-input-dir"),
            path(args, baseDir, properties.outputDir(), "output-dir"),
            PipelineStage.parseAll(stageValues),
            flag(args, "save-input", properties.saveInput()),
            flag(args, "reuse-grouping", properties.reuseGrouping()),
            flag(args, "run-ocr", properties.runOcr()),
            flag(args, "force-translate", properties.forceTranslate()),
            flag(args, "skip-existing", properties.skipExisting()),
            properties.sampleLimit(),
            List.copyOf(properties.excludedSegments()),
            properties.summaryFile()
        );
    }

    public boolean runs(PipelineStage stage) {
        return stages.contains(stage);
    }

    private static Path path(ApplicationArguments args, Path baseDir, String configured, String... names) {
        String fromArgs = option(args, names);
        if (fromArgs != null && !fromArgs.isBlank()) {
            return Path.of(fromArgs);
        }
        if (configured == null || configured.isBlank()) {
            return null;
        }
        return baseDir.resolve(configured).normalize();
    }

    private static boolean flag(ApplicationArguments args, String name, boolean configured) {
        if (args == null || !args.containsOption(name)) {
            return configured;
        }
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return true;
        }
        return Boolean.parseBoolean(values.get(values.size() - 1));
    }

    private static String option(ApplicationArguments args, String... names) {
        if (args == null) {
            return null;
        }
        for (String name : names) {
            if (args.containsOption(name)) {
                List<String> values = new ArrayList<>(args.getOptionValues(name));
                return values.isEmpty() ? null : values.get(values.size() - 1);
            }
        }
        return null;
    }

    private static String firstNonBlank(String first, String second) {
        return first != null && !first.isBlank() ? first : second;
    }
}
