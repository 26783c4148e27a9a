package dev.collab.backend;

import dev.collab.model.AgentType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Runs an external agent command for every turn. The prompt goes to stdin, the
 * working directory is the workspace root, and stdout is the agent's response.
 *
 * <p>Command arguments may contain {@code {agent}}, {@code {type}} and
 * {@code {collab}} placeholders. A non-zero exit code is reported as a failure.
 */
public final class CommandAgentProxy implements AgentProxy {

    private static final Logger log = LoggerFactory.getLogger(CommandAgentProxy.class);

    private final Map<AgentType, List<String>> commands;

    public CommandAgentProxy(Map<AgentType, List<String>> commands) {
        this.commands = new EnumMap<>(AgentType.class);
        commands.forEach((type, command) -> this.commands.put(type, List.copyOf(command)));
    }

    /** Use the same command for every agent type. */
    public static CommandAgentProxy forAllTypes(List<String> command) {
        var commands = new EnumMap<AgentType, List<String>>(AgentType.class);
        for (AgentType type : AgentType.values()) {
            commands.put(type, command);
        }
        return new CommandAgentProxy(commands);
    }

    @Override
    public String getName() {
        return "command";
    }

    @Override
    public AgentResponse invoke(AgentRequest request) {
        List<String> template = commands.get(request.agentType());
        if (template == null || template.isEmpty()) {
            return AgentResponse.failed("No command configured for agent type '%s'".formatted(request.agentType().id()));
        }
        List<String> command = expand(template, request);
        log.debug("Running agent command for '{}': {}", request.agentName(), command);

        Process process;
        try {
            var builder = new ProcessBuilder(command).directory(request.workspace().root().toFile());
            builder.environment().put("COLLAB_AGENT_NAME", request.agentName());
            builder.environment().put("COLLAB_AGENT_TYPE", request.agentType().id());
            builder.environment().put("COLLAB_WORKSPACE", request.workspace().root().toString());
            process = builder.start();
        } catch (IOException e) {
            return AgentResponse.failed("Failed to start agent command %s: %s".formatted(command, e.getMessage()));
        }

        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            Future<String> stdout = executor.submit(() -> readStream(process.getInputStream()));
            Future<String> stderr = executor.submit(() -> readStream(process.getErrorStream()));
            writePrompt(process, request.prompt());
            int exitCode = process.waitFor();
            String out = stdout.get();
            String err = stderr.get();
            if (exitCode != 0) {
                return AgentResponse.failed("Agent command exited with code %d: %s".formatted(exitCode, err.strip()));
            }
            return AgentResponse.ok(out);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            return AgentResponse.failed("Agent command interrupted");
        } catch (ExecutionException | IOException e) {
            process.destroyForcibly();
            return AgentResponse.failed("Agent command I/O failed: " + e.getMessage());
        } finally {
            shutdown(executor);
        }
    }

    private static List<String> expand(List<String> template, AgentRequest request) {
        var expanded = new ArrayList<String>(template.size());
        for (String arg : template) {
            expanded.add(arg
                .replace("{agent}", request.agentName())
                .replace("{type}", request.agentType().id())
                .replace("{collab}", request.workspace().collabDir().toString()));
        }
        return expanded;
    }

    private static void writePrompt(Process process, String prompt) throws IOException {
        try (OutputStream stdin = process.getOutputStream()) {
            stdin.write(Objects.requireNonNullElse(prompt, "").getBytes(StandardCharsets.UTF_8));
        }
    }

    private static String readStream(InputStream stream) throws IOException {
        try (InputStream input = stream) {
            return new String(input.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private static void shutdown(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(3, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }
}
