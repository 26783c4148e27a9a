package dev.collab.engine;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Stores each session as {@code <session_id>.json} in a directory. Writes go to a
 * temporary file first and are moved into place, so a crash never leaves a torn file.
 */
public final class JsonSessionStore implements SessionStore {

    private static final String SUFFIX = ".json";

    private final ObjectMapper mapper = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT)
        .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
    private final Path directory;

    public JsonSessionStore(Path directory) {
        this.directory = directory;
    }

    @Override
    public void save(PersistedSession session) throws IOException {
        Files.createDirectories(directory);
        Path target = fileFor(session.sessionId());
        Path temp = Files.createTempFile(directory, "session-", ".tmp");
        try {
            mapper.writeValue(temp.toFile(), session);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    @Override
    public Optional<PersistedSession> load(String sessionId) throws IOException {
        Path file = fileFor(sessionId);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        return Optional.of(mapper.readValue(file.toFile(), PersistedSession.class));
    }

    @Override
    public List<String> list() throws IOException {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(directory)) {
            return files.map(p -> p.getFileName().toString())
                .filter(name -> name.endsWith(SUFFIX))
                .map(name -> name.substring(0, name.length() - SUFFIX.length()))
                .sorted()
                .collect(Collectors.toList());
        }
    }

    private Path fileFor(String sessionId) {
        if (sessionId == null || sessionId.isBlank() || sessionId.contains("/") || sessionId.contains("\\")) {
            throw new IllegalArgumentException("Invalid session id: " + sessionId);
        }
        return directory.resolve(sessionId + SUFFIX);
    }
}
