package io.repoexpert.cli;

import io.repoexpert.core.agent.AgentSetupService;
import io.repoexpert.core.config.model.RepoExpertConfig;
import io.repoexpert.core.state.StateStore;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

@Command(name = "destroy", description = "Delete agents and forget their state")
public final class DestroyCommand implements Callable<Integer> {
    private final CliContext context;

    @ParentCommand
    RepoExpertCliCommand root;

    @Option(names = "--repo", description = "Destroy a single repo agent")
    String repo;

    public DestroyCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            RepoExpertConfig config = context.configService().load(context.configPath());
            StateStore stateStore = context.stateStore(root);
            AgentSetupService setupService = new AgentSetupService(
                context.provider(),
                stateStore,
                config.letta(),
                config.defaults(),
                context.clock()
            );
            for (String repoName : CommandSupport.selectRepos(repo, stateStore.load().agents().keySet())) {
                if (setupService.destroy(repoName)) {
                    System.out.println("Deleted agent for \"" + repoName + "\"");
                } else {
                    System.out.println("No agent for \"" + repoName + "\", skipping");
                }
            }
            System.out.println("Done.");
            return 0;
        } catch (Exception e) {
            System.err.println("Destroy command failed: " + e.getMessage());
            return 1;
        }
    }
}
