package dev.collab.backend;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Shared directory of a session. Agents write deliverables into {@code collab/}
 * and may keep private scratch files under their own directory. The handle stays
 * the same for the whole run, so later turns see earlier turns' files.
 */
public record Workspace(Path root) {

    public static final String COLLAB_DIR = "collab";

    public Path collabDir() {
        return root.resolve(COLLAB_DIR);
    }

    public Path agentDir(String agentName) {
        return root.resolve(agentName);
    }

    /**
     * Create the workspace layout for the given agents if it does not exist yet.
     */
    public static Workspace create(Path root, Iterable<String> agentNames) throws IOException {
        var workspace = new Workspace(root.toAbsolutePath().normalize());
        Files.createDirectories(workspace.collabDir());
        for (String agent : agentNames) {
            Files.createDirectories(workspace.agentDir(agent));
        }
        return workspace;
    }
}
