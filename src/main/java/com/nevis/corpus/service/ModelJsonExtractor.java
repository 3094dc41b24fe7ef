package com.nevis.corpus.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.nevis.corpus.exception.MalformedResponseException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Best-effort recovery of a JSON object from model output that may be wrapped in markdown fences or
 * surrounded by commentary.
 */
@Component
@RequiredArgsConstructor
public class ModelJsonExtractor {

    private static final String JSON_FENCE = "```json";
    private static final String FENCE = "```";

    private final ObjectMapper objectMapper;

    public ObjectNode parseObject(String raw) {
        String candidate = extractObjectText(raw);
        JsonNode node;
        try {
            node = objectMapper.readTree(candidate);
        } catch (JsonProcessingException e) {
            throw new MalformedResponseException("JSON parse error: " + e.getOriginalMessage(), raw, candidate, e);
        }
        if (node == null || !node.isObject()) {
            throw new MalformedResponseException("Response is not a JSON object", raw, candidate, null);
        }
        return (ObjectNode) node;
    }

    public static String extractObjectText(String raw) {
        if (raw == null) {
            return "";
        }
        return matchBraces(stripFences(raw.strip()));
    }

    public static String stripFences(String text) {
        int start;
        if (text.contains(JSON_FENCE)) {
            start = text.indexOf(JSON_FENCE) + JSON_FENCE.length();
        } else if (text.contains(FENCE)) {
            start = text.indexOf(FENCE) + FENCE.length();
        } else {
            return text;
        }
        int end = text.indexOf(FENCE, start);
        return end > start ? text.substring(start, end).strip() : text;
    }

    /**
     * Cuts the text down to the first balanced {@code {...}} block, ignoring braces inside strings.
     * Unbalanced input is returned from the first brace on.
     */
    static String matchBraces(String text) {
        int start = text.indexOf('{');
        if (start < 0) {
            return text;
        }

        int depth = 0;
        boolean inString = false;
        boolean escaped = false;
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return text.substring(start, i + 1);
                }
            }
        }
        return text.substring(start);
    }
}
