package com.nevis.corpus.service;

import com.nevis.corpus.exception.CorpusReadException;
import com.nevis.corpus.model.Page;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Service
@Slf4j
public class FileSystemPageLoader implements PageLoader {

    public static final String PAGE_EXTENSION = ".txt";
    public static final String TRANSLATION_SUFFIX = "_english.txt";

    @Override
    public List<Page> loadPages(Path root, Path translationDir) {
        if (!Files.isDirectory(root) || !Files.isReadable(root)) {
            throw new CorpusReadException(root, "Page directory is not readable");
        }

        List<Path> files = listPageFiles(root);
        log.info("Found {} page text files under {}", files.size(), root);

        Map<String, Page> pagesByKey = new LinkedHashMap<>();
        for (Path file : files) {
            String text;
            try {
                text = Files.readString(file, StandardCharsets.UTF_8);
            } catch (IOException e) {
                log.warn("Skipping unreadable page {}: {}", file, e.getMessage());
                continue;
            }

            String key = PageKeys.deriveKey(file.getFileName().toString());
            Page page = new Page(key, text, sourcePathOf(root, file), readTranslation(translationDir, key));

            if (pagesByKey.remove(key) != null) {
                log.debug("Page key {} collides; {} replaces the earlier file", key, file);
            }
            pagesByKey.put(key, page);
        }

        return List.copyOf(pagesByKey.values());
    }

    private static List<Path> listPageFiles(Path root) {
        return TolerantFileCollector.collect(root,
            path -> path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(PAGE_EXTENSION),
            dir -> true);
    }

    private String readTranslation(Path translationDir, String key) {
        if (translationDir == null) {
            return null;
        }
        Path candidate = translationDir.resolve(key + TRANSLATION_SUFFIX);
        if (!Files.isRegularFile(candidate)) {
            return null;
        }
        try {
            return Files.readString(candidate, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("Ignoring unreadable translation {}: {}", candidate, e.getMessage());
            return null;
        }
    }

    /**
     * Path of the page relative to the parent of the page root, e.g. {@code german_output/ABC_german.txt}.
     */
    static String sourcePathOf(Path root, Path file) {
        Path base = root.toAbsolutePath().normalize().getParent();
        Path absolute = file.toAbsolutePath().normalize();
        Path relative = base == null ? absolute : base.relativize(absolute);
        return relative.toString().replace('\\', '/');
    }
}
