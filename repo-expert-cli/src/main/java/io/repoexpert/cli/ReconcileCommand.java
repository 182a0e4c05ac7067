package io.repoexpert.cli;

import io.repoexpert.core.config.model.RepoExpertConfig;
import io.repoexpert.core.reconcile.DriftRepair;
import io.repoexpert.core.reconcile.ReconcileReport;
import io.repoexpert.core.reconcile.ReconcileService;
import io.repoexpert.core.state.AgentState;
import io.repoexpert.core.state.AppState;
import io.repoexpert.core.state.StateStore;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

@Command(name = "reconcile", description = "Compare local passage maps with the server and optionally repair drift")
public final class ReconcileCommand implements Callable<Integer> {
    private final CliContext context;

    @ParentCommand
    RepoExpertCliCommand root;

    @Option(names = "--repo", description = "Reconcile a single repo")
    String repo;

    @Option(names = "--fix", description = "Delete orphan passages and drop missing ones from the local map")
    boolean fix;

    public ReconcileCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            RepoExpertConfig config = context.configService().load(context.configPath());
            StateStore stateStore = context.stateStore(root);
            AppState state = stateStore.load();
            ReconcileService service = new ReconcileService(
                context.provider(),
                config.defaults().syncConcurrency(),
                context.observabilityService()
            );

            for (String repoName : CommandSupport.selectRepos(repo, state.agents().keySet())) {
                AgentState agent = CommandSupport.requireAgent(state, repoName);
                ReconcileReport report = service.reconcile(agent);
                System.out.println(repoName + ": local=" + report.localPassageCount()
                    + " server=" + report.serverPassageCount()
                    + (report.inSync() ? " in sync" : " orphans=" + report.plan().orphanPassageIds().size()
                        + " missing=" + report.plan().missingPassageIds().size()));
                if (report.inSync()) {
                    continue;
                }
                if (!fix) {
                    continue;
                }
                DriftRepair repair = service.fixDrift(agent, report.plan());
                state = state.withPassages(repoName, repair.passages());
                stateStore.save(state);
                System.out.println("  Fixed: deleted " + repair.orphansDeleted() + " orphans, dropped "
                    + report.plan().missingPassageIds().size() + " missing passages");
                if (!repair.failedOrphanDeletions().isEmpty()) {
                    System.out.println("  Could not delete " + repair.failedOrphanDeletions().size() + " orphans; run reconcile again");
                }
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Reconcile command failed: " + e.getMessage());
            return 1;
        }
    }
}
