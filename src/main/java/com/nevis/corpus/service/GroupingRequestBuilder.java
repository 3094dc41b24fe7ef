package com.nevis.corpus.service;

import com.nevis.corpus.model.Page;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Serializes pages for the grouping model. Page text and translations are copied verbatim between
 * explicit boundary markers; nothing is truncated here.
 */
@Component
public class GroupingRequestBuilder {

    public static final String LISTING_START = "--- PAGES START ---";
    public static final String LISTING_END = "--- PAGES END ---";
    public static final String PAGE_START = "=== PAGE START ===";
    public static final String PAGE_END = "=== PAGE END ===";

    static final String TASK_INSTRUCTIONS =
        """
            You will receive a list of document pages released by the House Oversight Committee.
            Each item has a filename and its full text content.
            Group pages that belong to the same narrative/letter/memo and order pages within each group.

            Rules:
            - Use ONLY the provided pages. Do not invent or omit pages.
            - Group pages that clearly continue the same document (shared salutations, signatures, identifiers, dates, or topics).
            - Order pages according to content flow; maintain chronological continuity when dates are present.
            - If a page is ambiguous, place it in the best-fitting group with low confidence or leave it unassigned.
            - Do NOT alter or rewrite page text. Preserve provenance.
            - Output STRICT JSON only with this schema (no commentary):
              {
                "letters": [
                  { "id": "L0001", "pages": ["<filename>", ...], "confidence": 0.0, "reason": "..." },
                  { "id": "L0002", "pages": [ ... ], "confidence": 0.0, "reason": "..." }
                ],
                "unassigned_pages": ["<filename>", ...]
              }
            """;

    public GroupingRequest build(List<Page> pages) {
        return new GroupingRequest(TASK_INSTRUCTIONS, buildListing(pages));
    }

    public String buildListing(List<Page> pages) {
        List<String> parts = new ArrayList<>();
        parts.add(LISTING_START);
        for (Page page : pages) {
            parts.add(PAGE_START);
            parts.add("filename: " + page.key());
            parts.add("text:");
            parts.add(page.text());
            if (page.hasTranslation()) {
                parts.add("english:");
                parts.add(page.translation());
            }
            parts.add(PAGE_END);
        }
        parts.add(LISTING_END);
        return String.join("\n", parts);
    }
}
