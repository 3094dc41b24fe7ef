package com.nevis.corpus.service;

public record GroupingRequest(
    String instructions,
    String listing
) {
    public String payload() {
        return instructions + "\n" + listing;
    }
}
