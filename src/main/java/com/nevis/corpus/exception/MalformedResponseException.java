package com.nevis.corpus.exception;

import lombok.Getter;

@Getter
public class MalformedResponseException extends RuntimeException {
    private final String rawResponse;
    private final String attemptedJson;

    public MalformedResponseException(String message, String rawResponse, String attemptedJson, Throwable cause) {
        super(message, cause);
        this.rawResponse = rawResponse;
        this.attemptedJson = attemptedJson;
    }
}
