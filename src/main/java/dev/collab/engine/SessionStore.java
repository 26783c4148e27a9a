package dev.collab.engine;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Persists session snapshots between driver invocations.
 */
public interface SessionStore {

    void save(PersistedSession session) throws IOException;

    Optional<PersistedSession> load(String sessionId) throws IOException;

    /** Ids of all stored sessions. */
    List<String> list() throws IOException;
}
