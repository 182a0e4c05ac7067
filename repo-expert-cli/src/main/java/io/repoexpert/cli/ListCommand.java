package io.repoexpert.cli;

import io.repoexpert.core.state.AgentState;
import io.repoexpert.core.state.AppState;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.ParentCommand;

@Command(name = "list", description = "List all agents")
public final class ListCommand implements Callable<Integer> {
    private final CliContext context;

    @ParentCommand
    RepoExpertCliCommand root;

    public ListCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            AppState state = context.stateStore(root).load();
            if (state.agents().isEmpty()) {
                System.out.println("No agents. Run \"repo-expert setup\" first.");
                return 0;
            }
            for (AgentState agent : state.agents().values()) {
                System.out.println("  " + agent.repoName()
                    + ": agent=" + agent.agentId()
                    + " files=" + agent.passages().fileCount()
                    + " passages=" + agent.passages().passageCount()
                    + " bootstrapped=" + (agent.lastBootstrap() != null ? "yes" : "no"));
            }
            return 0;
        } catch (Exception e) {
            System.err.println("List command failed: " + e.getMessage());
            return 1;
        }
    }
}
