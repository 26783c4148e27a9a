package dev.collab;

import dev.collab.cli.AgentCollabCli;
import picocli.CommandLine;

public class Main {
    public static void main(String[] args) {
        int exitCode = new CommandLine(new AgentCollabCli()).execute(args);
        System.exit(exitCode);
    }
}
