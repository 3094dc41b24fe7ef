package com.nevis.corpus.exception;

import lombok.Getter;

import java.nio.file.Path;

@Getter
public class CorpusReadException extends RuntimeException {
    private final Path directory;

    public CorpusReadException(Path directory, String message) {
        super(message + ": " + directory);
        this.directory = directory;
    }

    public CorpusReadException(Path directory, Throwable cause) {
        super("Cannot read corpus directory: " + directory, cause);
        this.directory = directory;
    }
}
