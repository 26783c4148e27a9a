package dev.collab.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One completed turn: who acted, what they were asked, and what they answered.
 * {@code turn} is the 1-based turn index within the session.
 */
public record TurnRecord(
    int turn,
    String state,
    String agent,
    String prompt,
    String rawResponse,
    String content,
    Map<String, DecisionValue> decisions
) {
    public TurnRecord {
        decisions = Collections.unmodifiableMap(new LinkedHashMap<>(decisions));
    }
}
