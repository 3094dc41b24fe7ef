package com.nevis.corpus.model;

public record ExplosiveFinding(
    String file,
    String note
) {}
