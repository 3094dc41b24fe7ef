package com.nevis.corpus.model;

import java.util.List;

public record GroupingProposal(
    List<ProposedGroup> letters,
    List<String> unassignedPages
) {}
