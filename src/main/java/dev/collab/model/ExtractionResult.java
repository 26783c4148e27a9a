package dev.collab.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of extracting the trailing control block from an agent response.
 */
public sealed interface ExtractionResult {

    record Success(String content, Map<String, DecisionValue> decisions, String json) implements ExtractionResult {
        public Success {
            decisions = Collections.unmodifiableMap(new LinkedHashMap<>(decisions));
        }
    }

    record Failure(String error, String candidate) implements ExtractionResult {}
}
