package com.nevis.corpus.exception;

import lombok.Getter;

@Getter
public class LetterWriteException extends RuntimeException {
    private final String folderName;

    public LetterWriteException(String folderName, Throwable cause) {
        super("Failed to write letter folder: " + folderName, cause);
        this.folderName = folderName;
    }

    public LetterWriteException(String folderName, String message) {
        super("Failed to write letter folder: " + folderName + ": " + message);
        this.folderName = folderName;
    }
}
