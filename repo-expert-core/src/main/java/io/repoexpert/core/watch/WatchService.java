package io.repoexpert.core.watch;

import io.repoexpert.core.collect.FileCollector;
import io.repoexpert.core.collect.FileInfo;
import io.repoexpert.core.config.ConfigPaths;
import io.repoexpert.core.config.model.RepoConfig;
import io.repoexpert.core.git.ChangeDetector;
import io.repoexpert.core.passage.PassageMap;
import io.repoexpert.core.state.AgentState;
import io.repoexpert.core.state.AppState;
import io.repoexpert.core.state.StateStore;
import io.repoexpert.core.sync.SyncResult;
import io.repoexpert.core.sync.SyncService;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Polls repositories and syncs every one whose HEAD moved past the last synced commit.
 *
 * <p>Each {@link #tick(List)} re-reads the state before saving, so commands run while the
 * watcher is alive are not overwritten. A repo whose sync fails is reported and retried on
 * the next tick.
 */
public final class WatchService {
    private static final Logger LOG = LoggerFactory.getLogger(WatchService.class);

    public static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(30);

    private final Map<String, RepoConfig> repos;
    private final StateStore stateStore;
    private final ChangeDetector changeDetector;
    private final FileCollector collector;
    private final SyncService syncService;
    private final Clock clock;
    private final Set<String> syncing = ConcurrentHashMap.newKeySet();

    public WatchService(
        Map<String, RepoConfig> repos,
        StateStore stateStore,
        ChangeDetector changeDetector,
        FileCollector collector,
        SyncService syncService,
        Clock clock
    ) {
        this.repos = Objects.requireNonNull(repos, "repos must not be null");
        this.stateStore = Objects.requireNonNull(stateStore, "stateStore must not be null");
        this.changeDetector = Objects.requireNonNull(changeDetector, "changeDetector must not be null");
        this.collector = Objects.requireNonNull(collector, "collector must not be null");
        this.syncService = Objects.requireNonNull(syncService, "syncService must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public static boolean shouldSync(String lastSyncCommit, String currentHead) {
        return !Objects.equals(lastSyncCommit, currentHead);
    }

    public static String formatSyncLog(String repoName, String fromCommit, String toCommit, int filesChanged, Duration took) {
        String from = fromCommit == null ? "initial" : shortCommit(fromCommit);
        String seconds = String.format(Locale.ROOT, "%.1f", took.toMillis() / 1000.0);
        return "[" + repoName + "] synced " + from + ".." + shortCommit(toCommit)
            + " (" + filesChanged + " files, " + seconds + "s)";
    }

    /**
     * Runs one polling pass.
     *
     * @return one log line per repo that was synced or failed; repos already up to date add nothing
     */
    public List<String> tick(List<String> repoNames) throws IOException {
        List<String> lines = new ArrayList<>();
        AppState state = stateStore.load();
        for (String repoName : repoNames) {
            Optional<AgentState> agent = state.agent(repoName);
            RepoConfig repo = repos.get(repoName);
            if (agent.isEmpty() || repo == null || !syncing.add(repoName)) {
                continue;
            }
            try {
                syncRepo(repoName, agent.get(), repo).ifPresent(lines::add);
            } catch (IOException | RuntimeException e) {
                LOG.warn("Watch sync of {} failed", repoName, e);
                lines.add("[" + repoName + "] sync error: " + e.getMessage());
            } finally {
                syncing.remove(repoName);
            }
        }
        return lines;
    }

    private Optional<String> syncRepo(String repoName, AgentState agent, RepoConfig repo) throws IOException {
        Path repoPath = ConfigPaths.resolve(repo.path());
        Optional<String> head = changeDetector.headCommit(repoPath);
        if (head.isEmpty() || !shouldSync(agent.lastSyncCommit(), head.get())) {
            return Optional.empty();
        }

        Instant started = clock.instant();
        List<String> changed;
        if (agent.lastSyncCommit() != null) {
            changed = collector.scopeToBase(repo, changeDetector.changedFiles(repoPath, agent.lastSyncCommit()));
        } else {
            changed = new ArrayList<>();
            for (FileInfo file : collector.collectAll(repo)) {
                changed.add(file.path());
            }
        }

        AppState fresh;
        if (changed.isEmpty()) {
            fresh = stateStore.load();
            fresh = fresh.withSync(repoName, currentPassages(fresh, agent), head.get(), clock.instant());
        } else {
            SyncResult result = syncService.sync(agent, changed, head.get(), path -> collector.collect(repo, path));
            fresh = stateStore.load().withSync(repoName, result.passages(), result.lastSyncCommit(), clock.instant());
        }
        stateStore.save(fresh);

        String line = formatSyncLog(repoName, agent.lastSyncCommit(), head.get(), changed.size(), Duration.between(started, clock.instant()));
        LOG.info(line);
        return Optional.of(line);
    }

    private static PassageMap currentPassages(AppState state, AgentState fallback) {
        return state.agent(fallback.repoName()).map(AgentState::passages).orElse(fallback.passages());
    }

    private static String shortCommit(String commit) {
        return commit.length() > 7 ? commit.substring(0, 7) : commit;
    }
}
