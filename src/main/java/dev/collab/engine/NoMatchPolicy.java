package dev.collab.engine;

/**
 * What the driver does when none of a state's transitions match.
 */
public enum NoMatchPolicy {
    /** End the run as TERMINATED. */
    TERMINATE,
    /** Run the same state again on the next turn, bounded by max_turns. */
    STAY
}
