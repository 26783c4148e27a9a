package dev.collab.engine;

import dev.collab.template.CollaborationGuide;

import java.time.Duration;
import java.util.Objects;

/**
 * Per-driver settings.
 */
public record DriverConfig(
    String collaborationGuide,
    Duration turnTimeout, // null means no timeout
    NoMatchPolicy noMatchPolicy,
    boolean checkpointEachTurn
) {
    public DriverConfig {
        Objects.requireNonNull(collaborationGuide, "collaborationGuide");
        Objects.requireNonNull(noMatchPolicy, "noMatchPolicy");
        if (turnTimeout != null && (turnTimeout.isNegative() || turnTimeout.isZero())) {
            throw new IllegalArgumentException("turnTimeout must be positive: " + turnTimeout);
        }
    }

    public static DriverConfig defaults() {
        return new DriverConfig(CollaborationGuide.DEFAULT, null, NoMatchPolicy.TERMINATE, true);
    }

    public DriverConfig withCollaborationGuide(String guide) {
        return new DriverConfig(guide, turnTimeout, noMatchPolicy, checkpointEachTurn);
    }

    public DriverConfig withTurnTimeout(Duration timeout) {
        return new DriverConfig(collaborationGuide, timeout, noMatchPolicy, checkpointEachTurn);
    }

    public DriverConfig withNoMatchPolicy(NoMatchPolicy policy) {
        return new DriverConfig(collaborationGuide, turnTimeout, policy, checkpointEachTurn);
    }

    public DriverConfig withCheckpointEachTurn(boolean checkpoint) {
        return new DriverConfig(collaborationGuide, turnTimeout, noMatchPolicy, checkpoint);
    }
}
