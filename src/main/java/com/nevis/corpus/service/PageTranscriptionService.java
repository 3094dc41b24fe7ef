package com.nevis.corpus.service;

import com.nevis.corpus.exception.CollaboratorException;
import com.nevis.corpus.exception.CorpusReadException;
import com.nevis.corpus.infra.ErrorLogWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Produces page text for scanned images that have none yet.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PageTranscriptionService {

    public static final String PAGE_SUFFIX = "_german.txt";

    private static final List<String> IMAGE_EXTENSIONS = List.of(".jpg", ".jpeg", ".png");

    static final String TRANSCRIPTION_PROMPT =
        """
            This is a single page image from an official House Oversight Committee document set.
            Transcribe the text exactly as it appears (handwritten, typed, stamped, etc.).
            Do not add numbering, bullets, labels, or commentary.
            Do not prefix lines with numbers or symbols.
            Return only the raw text with original line breaks.""";

    private final CollaboratorClient collaboratorClient;
    private final ErrorLogWriter errorLogWriter;

    /**
     * Transcribes every image in {@code imagesDir} whose page file is missing from {@code textDir}.
     * Existing page files are never overwritten. Returns the number of images sent.
     */
    public int transcribeMissing(Path imagesDir, Path textDir) {
        List<Path> images = listImages(imagesDir);
        int sent = 0;

        for (int i = 0; i < images.size(); i++) {
            Path image = images.get(i);
            String key = PageKeys.deriveKey(image.getFileName().toString());
            Path target = textDir.resolve(key + PAGE_SUFFIX);
            if (Files.exists(target)) {
                continue;
            }

            log.info("[{}/{}] OCR: {}", i + 1, images.size(), image.getFileName());
            sent++;
            String text;
            try {
                text = collaboratorClient.sendImage(TRANSCRIPTION_PROMPT, image);
            } catch (CollaboratorException e) {
                log.error("OCR error for {}: {}", image, e.getMessage());
                errorLogWriter.write(textDir.resolve(key + "_ocr_error.log"),
                    "OCR failed for " + image.getFileName() + ": " + e.getMessage(), Map.of());
                text = "";
            }

            try {
                Files.createDirectories(textDir);
                Files.writeString(target, text, StandardCharsets.UTF_8);
            } catch (IOException e) {
                log.error("Could not write page text {}: {}", target, e.getMessage());
            }
        }
        return sent;
    }

    private static List<Path> listImages(Path imagesDir) {
        try (Stream<Path> files = Files.list(imagesDir)) {
            return files
                .filter(Files::isRegularFile)
                .filter(PageTranscriptionService::isImage)
                .sorted(Comparator.comparing(Path::toString))
                .toList();
        } catch (IOException e) {
            throw new CorpusReadException(imagesDir, e);
        }
    }

    private static boolean isImage(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return IMAGE_EXTENSIONS.stream().anyMatch(name::endsWith);
    }
}
