package com.nevis.corpus.service;

import java.nio.file.Path;

/**
 * Blocking request/response boundary to the hosted model. Implementations return the fully
 * materialized response text or fail with a {@link com.nevis.corpus.exception.CollaboratorException}.
 */
public interface CollaboratorClient {
    String sendText(String prompt);
    String sendImage(String prompt, Path imagePath);
}
