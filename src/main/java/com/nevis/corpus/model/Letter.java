package com.nevis.corpus.model;

import java.util.List;

public record Letter(
    String id,
    String folderName,
    List<String> pageKeys,
    String concatenatedText,
    List<String> sourceFiles,
    List<String> referenceIds,
    ProposedGroup proposedGroup
) {}
