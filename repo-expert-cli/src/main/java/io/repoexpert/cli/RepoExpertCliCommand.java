package io.repoexpert.cli;

import java.nio.file.Path;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "repo-expert", mixinStandardHelpOptions = true, description = "Persistent AI agents for git repositories")
public final class RepoExpertCliCommand implements Runnable {

    @Option(names = "--state", description = "State file (default: ./.repo-expert-state.json)")
    Path statePath;

    public Path statePath() {
        return statePath;
    }

    @Override
    public void run() {
        // Root command only shows help when no subcommand is provided.
    }
}
