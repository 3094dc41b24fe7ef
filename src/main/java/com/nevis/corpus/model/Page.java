package com.nevis.corpus.model;

public record Page(
    String key,
    String text,
    String sourcePath,
    String translation
) {
    public boolean hasTranslation() {
        return translation != null && !translation.isEmpty();
    }
}
