package dev.collab.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Capability tag of a declared agent. The agent proxy decides what each tag means.
 */
public enum AgentType {
    CODER("coder"),
    ARCHITECT("architect"),
    ASK("ask");

    private final String id;

    AgentType(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public static Optional<AgentType> fromId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values()).filter(t -> t.id.equals(normalized)).findFirst();
    }
}
