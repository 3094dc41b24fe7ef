package com.nevis.corpus.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.nevis.corpus.exception.CollaboratorException;
import com.nevis.corpus.exception.MalformedResponseException;
import com.nevis.corpus.infra.ErrorLogWriter;
import com.nevis.corpus.model.GroupingProposal;
import com.nevis.corpus.model.Page;
import com.nevis.corpus.model.ProposedGroup;
import com.nevis.corpus.repository.GroupingRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
@Slf4j
@RequiredArgsConstructor
public class GroupingService {

    private final GroupingRequestBuilder requestBuilder;
    private final CollaboratorClient collaboratorClient;
    private final GroupingRepository groupingRepository;
    private final ModelJsonExtractor jsonExtractor;
    private final ErrorLogWriter errorLogWriter;

    /**
     * Asks the model for a grouping of the pages, or replays the persisted response when {@code reuse}
     * is set and one exists. The raw response is persisted before it is parsed.
     *
     * @throws CollaboratorException      when the model call fails
     * @throws MalformedResponseException when no JSON object can be recovered from the response
     */
    public GroupingProposal proposeGrouping(List<Page> pages, Path lettersDir, boolean reuse, boolean saveInput) {
        GroupingRequest request = requestBuilder.build(pages);
        if (saveInput) {
            groupingRepository.saveInput(lettersDir, request.listing());
        }

        Optional<String> cached = reuse ? groupingRepository.findRawResponse(lettersDir) : Optional.empty();
        String raw;
        if (cached.isPresent()) {
            log.info("Reusing existing grouping JSON in {}", lettersDir);
            raw = cached.get();
        } else {
            log.info("Submitting {} pages for grouping", pages.size());
            try {
                raw = collaboratorClient.sendText(request.payload()).strip();
            } catch (CollaboratorException e) {
                errorLogWriter.write(lettersDir.resolve(GroupingRepository.ERROR_FILE),
                    "Grouping request failed: " + e.getMessage(), Map.of());
                throw e;
            }
            groupingRepository.saveRawResponse(lettersDir, raw);
        }

        try {
            return parseProposal(raw);
        } catch (MalformedResponseException e) {
            Map<String, String> sections = new LinkedHashMap<>();
            sections.put("RAW RESPONSE (first 2000 chars):", e.getRawResponse());
            sections.put("ATTEMPTED JSON TEXT:", e.getAttemptedJson());
            errorLogWriter.write(lettersDir.resolve(GroupingRepository.ERROR_FILE),
                "Error parsing grouping JSON: " + e.getMessage(), sections);
            throw e;
        }
    }

    /**
     * Validates the model output field by field. Entries that are not objects and page references that
     * are not strings are skipped; {@code confidence} and {@code reason} stay as received in the raw entry.
     */
    public GroupingProposal parseProposal(String raw) {
        ObjectNode root = jsonExtractor.parseObject(raw);

        List<ProposedGroup> groups = new ArrayList<>();
        JsonNode letters = root.path("letters");
        if (letters.isArray()) {
            int position = 0;
            for (JsonNode entry : letters) {
                position++;
                if (!entry.isObject()) {
                    log.warn("Ignoring grouping entry #{}: not an object", position);
                    continue;
                }
                groups.add(toProposedGroup((ObjectNode) entry, position));
            }
        } else if (!letters.isMissingNode()) {
            log.warn("Grouping response field 'letters' is not an array, ignoring it");
        }

        return new GroupingProposal(List.copyOf(groups), textValues(root.path("unassigned_pages")));
    }

    private ProposedGroup toProposedGroup(ObjectNode entry, int position) {
        JsonNode idNode = entry.path("id");
        String id = (idNode.isTextual() || idNode.isNumber()) && isSafeFolderId(idNode.asText())
            ? idNode.asText()
            : String.format("L%04d", position);
        if (!idNode.isMissingNode() && !id.equals(idNode.asText())) {
            log.warn("Grouping entry #{} has unusable id '{}', using {}", position, idNode.asText(), id);
        }

        JsonNode confidence = entry.path("confidence");
        JsonNode reason = entry.path("reason");

        return new ProposedGroup(
            id,
            textValues(entry.path("pages")),
            confidence.isNumber() ? confidence.doubleValue() : null,
            reason.isTextual() ? reason.textValue() : null,
            entry
        );
    }

    /**
     * Whether a model-supplied id can be used as a single folder name under the letters directory.
     */
    static boolean isSafeFolderId(String id) {
        if (id == null || id.isBlank()) {
            return false;
        }
        String trimmed = id.strip();
        return !trimmed.contains("/")
            && !trimmed.contains("\\")
            && !trimmed.contains("..")
            && !".".equals(trimmed)
            && trimmed.indexOf(':') < 0
            && trimmed.indexOf('\0') < 0;
    }

    private static List<String> textValues(JsonNode node) {
        if (!node.isArray()) {
            return List.of();
        }
        List<String> values = new ArrayList<>(node.size());
        for (JsonNode value : node) {
            if (value.isTextual()) {
                values.add(value.textValue());
            }
        }
        return List.copyOf(values);
    }
}
