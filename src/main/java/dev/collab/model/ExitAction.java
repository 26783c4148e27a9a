package dev.collab.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * What a matched exit condition does to the run.
 */
public enum ExitAction {
    /** Terminate immediately. */
    FORCE_END("force_end"),
    /** Persist the session, then terminate with the error flag set. */
    SAVE_AND_END("save_and_end");

    private final String id;

    ExitAction(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public static Optional<ExitAction> fromId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values()).filter(a -> a.id.equals(normalized)).findFirst();
    }
}
