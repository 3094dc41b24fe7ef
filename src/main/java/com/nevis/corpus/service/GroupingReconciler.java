package com.nevis.corpus.service;

import com.nevis.corpus.model.GroupingProposal;
import com.nevis.corpus.model.Page;
import com.nevis.corpus.model.ProposedGroup;
import com.nevis.corpus.model.ReconciledGroup;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves model-proposed page references against the pages actually loaded.
 *
 * <p>A reference is looked up by exact key first. On a miss, its ID prefix (the text before the first
 * {@code _}) is looked up in a prefix index that keeps the last page seen per prefix, in load order.
 * References that resolve to nothing are left out of the group. Pages referenced by several groups are
 * resolved for each of them.
 */
@Component
@Slf4j
public class GroupingReconciler {

    public List<ReconciledGroup> reconcile(GroupingProposal proposal, List<Page> pages) {
        PageIndex index = PageIndex.of(pages);

        List<ReconciledGroup> reconciled = new ArrayList<>(proposal.letters().size());
        int unresolved = 0;
        for (ProposedGroup group : proposal.letters()) {
            ReconciledGroup result = reconcile(group, index);
            unresolved += result.unresolvedReferences().size();
            reconciled.add(result);
        }

        log.info("Reconciled {} proposed letters against {} pages ({} unresolved references, {} pages left unassigned)",
            reconciled.size(), pages.size(), unresolved, proposal.unassignedPages().size());
        return reconciled;
    }

    ReconciledGroup reconcile(ProposedGroup group, PageIndex index) {
        List<Page> resolved = new ArrayList<>();
        List<String> missing = new ArrayList<>();

        for (String reference : group.pageReferences()) {
            index.resolve(reference).ifPresentOrElse(resolved::add, () -> {
                log.debug("Letter {}: page reference '{}' matches no loaded page, dropping it", group.id(), reference);
                missing.add(reference);
            });
        }

        return new ReconciledGroup(group, List.copyOf(resolved), List.copyOf(missing));
    }

    static final class PageIndex {
        private final Map<String, Page> byKey;
        private final Map<String, Page> byPrefix;

        private PageIndex(Map<String, Page> byKey, Map<String, Page> byPrefix) {
            this.byKey = byKey;
            this.byPrefix = byPrefix;
        }

        static PageIndex of(List<Page> pages) {
            Map<String, Page> byKey = new HashMap<>();
            Map<String, Page> byPrefix = new HashMap<>();
            for (Page page : pages) {
                byKey.put(page.key(), page);
                Page previous = byPrefix.put(PageKeys.idPrefix(page.key()), page);
                if (previous != null && !previous.key().equals(page.key())) {
                    log.debug("Prefix {} shared by {} and {}; only {} stays reachable by prefix",
                        PageKeys.idPrefix(page.key()), previous.key(), page.key(), page.key());
                }
            }
            return new PageIndex(byKey, byPrefix);
        }

        Optional<Page> resolve(String reference) {
            if (reference == null) {
                return Optional.empty();
            }
            Page exact = byKey.get(reference);
            if (exact != null) {
                return Optional.of(exact);
            }
            return Optional.ofNullable(byPrefix.get(PageKeys.idPrefix(reference)));
        }
    }
}
