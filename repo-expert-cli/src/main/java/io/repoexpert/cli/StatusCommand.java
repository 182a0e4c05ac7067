package io.repoexpert.cli;

import io.repoexpert.core.admin.AdminPort;
import io.repoexpert.core.admin.CoreMemoryBlock;
import io.repoexpert.core.admin.ProviderAdminAdapter;
import io.repoexpert.core.state.AgentState;
import io.repoexpert.core.state.AppState;
import java.nio.file.Files;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

@Command(name = "status", description = "Show agent memory stats and health")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    @ParentCommand
    RepoExpertCliCommand root;

    @Option(names = "--repo", description = "Show status for a single repo")
    String repo;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            System.out.println("Config path: " + context.configPath());
            System.out.println("Config exists: " + Files.exists(context.configPath()));
            System.out.println("Letta configured: " + context.configService().load(context.configPath()).letta().configured());

            AppState state = context.stateStore(root).load();
            AdminPort admin = new ProviderAdminAdapter(context.provider());
            for (String repoName : CommandSupport.selectRepos(repo, state.agents().keySet())) {
                AgentState agent = CommandSupport.requireAgent(state, repoName);
                int serverPassages = context.provider().listPassages(agent.agentId()).size();
                System.out.println(repoName + " (" + agent.agentId() + ")");
                System.out.println("  Files: " + agent.passages().fileCount()
                    + "  Passages: local=" + agent.passages().passageCount() + " server=" + serverPassages);
                for (CoreMemoryBlock block : admin.getCoreMemory(agent.agentId())) {
                    System.out.println("  Block " + block.label() + ": " + block.value().length() + "/" + block.limit() + " chars");
                }
                System.out.println("  Last sync: " + CommandSupport.shortCommit(agent.lastSyncCommit())
                    + (agent.lastSyncAt() == null ? "" : " at " + agent.lastSyncAt()));
                System.out.println("  Last bootstrap: " + (agent.lastBootstrap() == null ? "never" : agent.lastBootstrap()));
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }
}
