package com.nevis.corpus.service;

import java.util.List;
import java.util.Locale;

/**
 * Canonical page keys derived from file names.
 */
public final class PageKeys {

    /** Checked in order; the first match wins. */
    public static final List<String> KNOWN_SUFFIXES = List.of("_german.txt", "_text.txt", ".txt");

    public static final char PREFIX_SEPARATOR = '_';

    private PageKeys() {
    }

    public static String deriveKey(String fileName) {
        String lower = fileName.toLowerCase(Locale.ROOT);
        for (String suffix : KNOWN_SUFFIXES) {
            if (lower.endsWith(suffix)) {
                return fileName.substring(0, fileName.length() - suffix.length());
            }
        }
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    /**
     * The part of a key before its first separator, or the whole key when it has none.
     */
    public static String idPrefix(String key) {
        int separator = key.indexOf(PREFIX_SEPARATOR);
        return separator < 0 ? key : key.substring(0, separator);
    }
}
