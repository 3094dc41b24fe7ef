package com.nevis.corpus.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.List;

/**
 * Defaults for a pipeline run. Relative directories are resolved against {@code baseDir};
 * command line flags override any of them for a single run.
 */
@Validated
@ConfigurationProperties(prefix = "app.pipeline")
public record PipelineProperties(
	@NotBlank String baseDir,
	@NotBlank String textDir,
	String imagesDir,
	String translationDir,
	@NotBlank String lettersDir,
	@NotBlank String textInputDir,
	@NotBlank String outputDir,
	@NotEmpty List<String> stages,
	boolean saveInput,
	boolean reuseGrouping,
	boolean runOcr,
	boolean forceTranslate,
	boolean skipExisting,
	@NotNull @Min(0) @Max(1000) Integer sampleLimit,
	@NotNull List<String> excludedSegments,
	@NotBlank String summaryFile
) {}
