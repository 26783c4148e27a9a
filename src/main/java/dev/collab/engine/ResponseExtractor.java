package dev.collab.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.collab.model.DecisionValue;
import dev.collab.model.ExtractionResult;

/**
 * Extracts the trailing JSON control block from agent response text.
 *
 * <p>Agents work "files first, JSON last": the reply ends with an object of the
 * form {@code {"content": "...", "decisions": {...}}}, optionally closed by a
 * markdown fence. The extractor walks backward over every {@code '{'} and takes
 * the first one that opens a complete JSON object running to the end of the
 * text and carrying both fields. Inner objects such as the decisions map parse
 * too but lack the fields, so the walk continues outward.
 */
public final class ResponseExtractor {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
        .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);

    private ResponseExtractor() {}

    /**
     * Extract content and decisions from the agent's response text.
     *
     * @param responseText the full agent response
     * @return success with content and decisions, or failure with error details
     */
    public static ExtractionResult extract(String responseText) {
        if (responseText == null || responseText.isBlank()) {
            return new ExtractionResult.Failure("Empty response", null);
        }

        String tail = stripTrailingFence(responseText.strip());
        if (!tail.endsWith("}")) {
            return new ExtractionResult.Failure("No JSON control block found at the end of the response", null);
        }

        String lastError = null;
        String lastCandidate = null;
        int from = tail.length() - 1;
        while (from >= 0) {
            int start = tail.lastIndexOf('{', from);
            if (start < 0) {
                break;
            }
            String candidate = tail.substring(start);
            from = start - 1;

            JsonNode node;
            try {
                node = MAPPER.readTree(candidate);
            } catch (JsonProcessingException e) {
                if (lastError == null) {
                    lastError = "Invalid JSON: " + e.getOriginalMessage();
                    lastCandidate = candidate;
                }
                continue;
            }
            if (node == null || !node.isObject()) {
                continue;
            }
            if (!node.has("content") && !node.has("decisions")) {
                continue;
            }
            return validate(node, candidate);
        }

        if (lastError != null) {
            return new ExtractionResult.Failure(lastError, lastCandidate);
        }
        return new ExtractionResult.Failure("No JSON object with 'content' and 'decisions' found", null);
    }

    private static ExtractionResult validate(JsonNode node, String candidate) {
        JsonNode content = node.get("content");
        if (content == null || !content.isTextual()) {
            return new ExtractionResult.Failure("Missing or non-string 'content' field", candidate);
        }
        JsonNode decisions = node.get("decisions");
        if (decisions == null || !decisions.isObject()) {
            return new ExtractionResult.Failure("Missing or non-object 'decisions' field", candidate);
        }
        return new ExtractionResult.Success(content.textValue(), DecisionValue.mapFromJson(decisions), candidate);
    }

    private static String stripTrailingFence(String text) {
        String stripped = text;
        if (stripped.endsWith("```")) {
            stripped = stripped.substring(0, stripped.length() - 3).strip();
        }
        return stripped;
    }
}
