package io.repoexpert.cli;

import io.repoexpert.core.chunk.Chunker;
import io.repoexpert.core.collect.FileCollector;
import io.repoexpert.core.collect.FileInfo;
import io.repoexpert.core.config.ConfigPaths;
import io.repoexpert.core.config.model.RepoConfig;
import io.repoexpert.core.config.model.RepoExpertConfig;
import io.repoexpert.core.state.AgentState;
import io.repoexpert.core.state.AppState;
import io.repoexpert.core.state.StateStore;
import io.repoexpert.core.sync.SyncResult;
import io.repoexpert.core.sync.SyncService;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

@Command(name = "sync", description = "Push file changes since the last sync to the agents")
public final class SyncCommand implements Callable<Integer> {
    private final CliContext context;

    @ParentCommand
    RepoExpertCliCommand root;

    @Option(names = "--repo", description = "Sync a single repo")
    String repo;

    @Option(names = "--full", description = "Re-index every file instead of the changed ones")
    boolean full;

    @Option(names = "--since", description = "Git ref to diff from (overrides the stored commit)")
    String since;

    public SyncCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            RepoExpertConfig config = context.configService().load(context.configPath());
            StateStore stateStore = context.stateStore(root);
            AppState state = stateStore.load();
            FileCollector collector = new FileCollector(config.defaults());
            SyncService syncService = new SyncService(
                context.provider(),
                new Chunker(config.defaults().maxChunkSize()),
                config.defaults().syncConcurrency(),
                config.defaults().fullReIndexThreshold(),
                context.clock(),
                context.observabilityService()
            );

            for (String repoName : CommandSupport.selectRepos(repo, state.agents().keySet())) {
                AgentState agent = CommandSupport.requireAgent(state, repoName);
                RepoConfig repoConfig = CommandSupport.requireRepo(config, repoName);
                Path repoPath = ConfigPaths.resolve(repoConfig.path());
                String head = context.changeDetector().headCommit(repoPath)
                    .orElseThrow(() -> new IOException(repoPath + " is not a git repository"));

                List<String> changed;
                if (full) {
                    changed = allFiles(collector, repoConfig, agent);
                    System.out.println("Syncing \"" + repoName + "\" (full re-index, " + changed.size() + " files)...");
                } else {
                    String sinceRef = since != null ? since : agent.lastSyncCommit();
                    if (sinceRef == null) {
                        System.out.println("No previous sync for \"" + repoName + "\". Use --full for initial sync, or run setup.");
                        continue;
                    }
                    changed = collector.scopeToBase(repoConfig, context.changeDetector().changedFiles(repoPath, sinceRef));
                    System.out.println("Syncing \"" + repoName + "\" (" + changed.size() + " changed files since "
                        + CommandSupport.shortCommit(sinceRef) + ")...");
                }

                if (changed.isEmpty()) {
                    System.out.println("  No changes to sync.");
                    state = state.withSync(repoName, agent.passages(), head, context.clock().instant());
                    stateStore.save(state);
                    continue;
                }

                SyncResult result = syncService.sync(agent, changed, head, path -> collector.collect(repoConfig, path));
                if (result.isFullReIndex() && !full) {
                    System.out.println("  Warning: " + changed.size() + " files changed, consider --full re-index");
                }
                System.out.println("  Deleted: " + result.filesDeleted() + " files, Re-indexed: " + result.filesReIndexed() + " files");
                state = state.withSync(repoName, result.passages(), result.lastSyncCommit(), context.clock().instant());
                stateStore.save(state);
                System.out.println("  Done.");
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Sync command failed: " + e.getMessage());
            return 1;
        }
    }

    /**
     * Every indexable file plus every file the agent still holds passages for, so files
     * removed from disk are purged too.
     */
    private List<String> allFiles(FileCollector collector, RepoConfig repoConfig, AgentState agent) throws IOException {
        Set<String> paths = new LinkedHashSet<>();
        for (FileInfo file : collector.collectAll(repoConfig)) {
            paths.add(file.path());
        }
        paths.addAll(agent.passages().files());
        return new ArrayList<>(paths);
    }
}
