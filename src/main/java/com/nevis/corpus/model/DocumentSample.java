package com.nevis.corpus.model;

import com.fasterxml.jackson.databind.JsonNode;

public record DocumentSample(
    String file,
    JsonNode data
) {}
