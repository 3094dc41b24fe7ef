package com.nevis.corpus.model;

import java.util.List;

public record ReconciledGroup(
    ProposedGroup group,
    List<Page> pages,
    List<String> unresolvedReferences
) {
    public boolean isComplete() {
        return unresolvedReferences.isEmpty();
    }
}
