package io.repoexpert.cli;

import io.repoexpert.core.agent.AgentSetupService;
import io.repoexpert.core.agent.SetupMode;
import io.repoexpert.core.agent.SetupResult;
import io.repoexpert.core.config.ConfigPaths;
import io.repoexpert.core.config.model.RepoConfig;
import io.repoexpert.core.config.model.RepoExpertConfig;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

@Command(name = "setup", description = "Create, index and bootstrap agents for configured repositories")
public final class SetupCommand implements Callable<Integer> {
    private final CliContext context;

    @ParentCommand
    RepoExpertCliCommand root;

    @Option(names = "--repo", description = "Set up a single repo")
    String repo;

    public SetupCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            RepoExpertConfig config = context.configService().load(context.configPath());
            AgentSetupService setupService = new AgentSetupService(
                context.provider(),
                context.stateStore(root),
                config.letta(),
                config.defaults(),
                context.clock()
            );

            for (String repoName : CommandSupport.selectRepos(repo, config.repos().keySet())) {
                RepoConfig repoConfig = CommandSupport.requireRepo(config, repoName);
                String head = context.changeDetector().headCommit(ConfigPaths.resolve(repoConfig.path())).orElse(null);
                System.out.println("Setting up \"" + repoName + "\"...");
                SetupResult result = setupService.setup(repoName, repoConfig, head);
                print(repoName, result);
            }
            System.out.println("Setup complete.");
            return 0;
        } catch (Exception e) {
            System.err.println("Setup command failed: " + e.getMessage());
            return 1;
        }
    }

    private void print(String repoName, SetupResult result) {
        if (result.mode() == SetupMode.SKIP) {
            System.out.println("  Agent for \"" + repoName + "\" already exists (" + result.agent().agentId() + "), skipping");
            return;
        }
        System.out.println("  Agent: " + result.agent().agentId());
        if (result.passagesStored() > 0 || result.mode() != SetupMode.RESUME_BOOTSTRAP) {
            System.out.println("  Indexed " + result.filesIndexed() + " files (" + result.passagesStored() + " passages)");
        }
        if (result.bootstrapped()) {
            System.out.println("  Bootstrap complete");
        }
    }
}
