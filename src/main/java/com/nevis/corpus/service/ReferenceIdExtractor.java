package com.nevis.corpus.service;

import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls structured document identifiers out of source file names.
 */
@Component
public class ReferenceIdExtractor {

    private static final Pattern HOUSE_OVERSIGHT_PATTERN =
        Pattern.compile("house[_-]?oversight[_-]?(\\d+)", Pattern.CASE_INSENSITIVE);

    private static final Pattern DIGIT_RUN = Pattern.compile("\\d{4,}");

    /**
     * Canonical identifiers in the name, or every run of four or more digits when there are none.
     */
    public List<String> extract(String fileName) {
        List<String> ids = new ArrayList<>();
        Matcher canonical = HOUSE_OVERSIGHT_PATTERN.matcher(fileName);
        while (canonical.find()) {
            ids.add(canonical.group(1));
        }
        if (!ids.isEmpty()) {
            return ids;
        }

        Matcher digits = DIGIT_RUN.matcher(fileName);
        while (digits.find()) {
            ids.add(digits.group());
        }
        return ids;
    }

    /**
     * Identifiers of all given source paths (file name part only), deduplicated in first-seen order.
     */
    public List<String> extractAll(Collection<String> sourcePaths) {
        Set<String> ordered = new LinkedHashSet<>();
        for (String sourcePath : sourcePaths) {
            ordered.addAll(extract(fileNameOf(sourcePath)));
        }
        return List.copyOf(ordered);
    }

    public Optional<String> canonicalId(String fileName) {
        Matcher canonical = HOUSE_OVERSIGHT_PATTERN.matcher(fileName);
        return canonical.find() ? Optional.of(canonical.group(1)) : Optional.empty();
    }

    private static String fileNameOf(String sourcePath) {
        Path name = Path.of(sourcePath.replace('\\', '/')).getFileName();
        return name == null ? sourcePath : name.toString();
    }
}
