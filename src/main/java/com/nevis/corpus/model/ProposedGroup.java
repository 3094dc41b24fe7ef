package com.nevis.corpus.model;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * One letter as proposed by the grouping model. Untrusted: page references are resolved against
 * the loaded pages before use. {@code raw} keeps the entry exactly as received.
 */
public record ProposedGroup(
    String id,
    List<String> pageReferences,
    Double confidence,
    String reason,
    ObjectNode raw
) {}
