package com.nevis.corpus.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.nevis.corpus.exception.CollaboratorException;
import com.nevis.corpus.model.AggregatedSnapshot;
import com.nevis.corpus.model.DocumentSample;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@Slf4j
@RequiredArgsConstructor
public class SummaryGeneratorServiceImpl implements SummaryGeneratorService {

    public static final String NO_DOCUMENTS_MESSAGE =
        "No documents have been processed yet. Summary will appear as processing begins.";

    static final int MAX_INDIVIDUALS = 50;
    static final int MAX_ORGANIZATIONS = 30;
    static final int MAX_LOCATIONS = 30;
    static final int MAX_SAMPLES = 10;

    private static final String SUMMARY_PROMPT =
        """
            You are analyzing House Oversight Committee documents related to high-profile investigations. You have been given aggregated data from ALL processed documents.

            Create a STRATEGIC, HIGH-LEVEL summary that journalists and investigators can use. Focus on:

            1. NAMED INDIVIDUALS: List ALL people explicitly named or identified across all documents
            2. MOST EXPLOSIVE FINDINGS: The top 5-10 most significant revelations (ranked by newsworthiness)
            3. DOCUMENT SCOPE: What types of evidence, date ranges, sources
            4. PATTERNS & CONNECTIONS: Relationships, recurring themes, timeline patterns
            5. LEGAL/FINANCIAL IMPLICATIONS: Potential violations, financial dealings, legal significance

            FORMAT - Start directly with sections (NO preamble):

            ### Named Individuals Identified
            [List all named people with brief context for each]

            ### Most Explosive Findings
            [Ranked list of 5-10 most significant revelations with document references]

            ### Document Analysis
            - Total documents processed: [number]
            - Date range: [if identifiable]
            - Document types: [photos, financial records, communications, etc.]

            ### Key Patterns & Connections
            [Identify relationships, recurring locations, timeline connections]

            ### Legal & Financial Significance
            [Potential implications, violations, financial dealings]

            Be specific, factual, and concise. Total length: 400-600 words. This is for investigative journalists - prioritize newsworthiness and verifiable facts.

            AGGREGATED DATA FROM ALL PROCESSED DOCUMENTS:

            Total Documents Analyzed: %d

            Named Individuals Found: %d
            %s

            Organizations Found: %d
            %s

            Locations Identified: %d
            %s

            Document Types:
            %s

            Sample Document Data (for context):
            %s

            Now create the strategic summary as specified above. Focus on newsworthiness, named individuals, and explosive findings.""";

    private final CollaboratorClient collaboratorClient;
    private final ObjectMapper objectMapper;

    @Override
    public String generateSummary(AggregatedSnapshot snapshot) {
        if (snapshot.isEmpty()) {
            log.info("No documents aggregated, skipping strategic summary request");
            return NO_DOCUMENTS_MESSAGE;
        }

        try {
            log.info("Sending aggregated data from {} documents for strategic analysis", snapshot.totalDocuments());
            String summary = stripMarkdownFence(collaboratorClient.sendText(buildPrompt(snapshot)).strip());
            if (summary.isBlank()) {
                log.warn("Strategic summary came back empty, using fallback report");
                return fallbackReport(snapshot);
            }
            log.info("Received strategic summary ({} chars)", summary.length());
            return summary;
        } catch (CollaboratorException e) {
            log.error("FAILED to generate strategic summary: {}", e.getMessage(), e);
            return fallbackReport(snapshot);
        }
    }

    String buildPrompt(AggregatedSnapshot snapshot) {
        return String.format(SUMMARY_PROMPT,
            snapshot.totalDocuments(),
            snapshot.namedIndividuals().size(),
            toJson(head(snapshot.namedIndividuals(), MAX_INDIVIDUALS)),
            snapshot.organizations().size(),
            toJson(head(snapshot.organizations(), MAX_ORGANIZATIONS)),
            snapshot.locations().size(),
            toJson(head(snapshot.locations(), MAX_LOCATIONS)),
            toJson(snapshot.documentTypeCounts()),
            toJson(samplesOf(snapshot))
        );
    }

    static String fallbackReport(AggregatedSnapshot snapshot) {
        return """
            ### Processing Status

            - Total documents analyzed: %d
            - Named individuals identified: %d
            - Organizations found: %d
            - Document types: %s

            (Strategic analysis temporarily unavailable - processing continues)""".formatted(
            snapshot.totalDocuments(),
            snapshot.namedIndividuals().size(),
            snapshot.organizations().size(),
            String.join(", ", snapshot.documentTypeCounts().keySet())
        );
    }

    static String stripMarkdownFence(String summary) {
        if (summary.startsWith("```markdown")) {
            return summary.replace("```markdown", "").replace("```", "").strip();
        }
        if (summary.startsWith("```")) {
            return summary.replace("```", "").strip();
        }
        return summary;
    }

    private ArrayNode samplesOf(AggregatedSnapshot snapshot) {
        ArrayNode samples = objectMapper.createArrayNode();
        for (DocumentSample sample : head(snapshot.samples(), MAX_SAMPLES)) {
            ObjectNode entry = samples.addObject();
            entry.put("file", sample.file());
            entry.set("data", sample.data());
        }
        return samples;
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Snapshot excerpt is not serializable", e);
        }
    }

    private static <T> List<T> head(List<T> values, int limit) {
        return values.size() <= limit ? values : values.subList(0, limit);
    }
}
