package com.nevis.corpus.model;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Processing stages in execution order.
 */
public enum PipelineStage {
    TEXT,
    LETTERS,
    TRANSLATE,
    SUMMARY;

    public static Set<PipelineStage> parseAll(List<String> values) {
        EnumSet<PipelineStage> stages = EnumSet.noneOf(PipelineStage.class);
        values.stream()
            .flatMap(value -> Arrays.stream(value.split(",")))
            .map(String::trim)
            .filter(value -> !value.isEmpty())
            .forEach(value -> {
                if ("all".equalsIgnoreCase(value)) {
                    stages.addAll(EnumSet.allOf(PipelineStage.class));
                } else {
                    stages.add(parse(value));
                }
            });
        if (stages.isEmpty()) {
            throw new IllegalArgumentException("No processing stage selected");
        }
        return stages;
    }

    public static PipelineStage parse(String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown stage: " + value
                + " (expected one of text, letters, translate, summary, all)", e);
        }
    }
}
