package io.repoexpert.core.sync;

import io.repoexpert.core.chunk.Chunk;
import io.repoexpert.core.chunk.Chunker;
import io.repoexpert.core.collect.FileInfo;
import io.repoexpert.core.observability.ObservabilityService;
import io.repoexpert.core.passage.PassageMap;
import io.repoexpert.core.provider.AgentProvider;
import io.repoexpert.core.state.AgentState;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies a {@link SyncPlan} to the remote store: deletes stale passages, then re-chunks and
 * stores every changed file that still exists.
 *
 * <p>A failed remote call aborts the sync and propagates. Passages already deleted or stored
 * at that point are left as they are; running the reconciler afterwards detects the drift.
 */
public final class SyncService {
    private static final Logger LOG = LoggerFactory.getLogger(SyncService.class);

    private final AgentProvider provider;
    private final SyncPlanner planner;
    private final Chunker chunker;
    private final int concurrency;
    private final int fullReIndexThreshold;
    private final Clock clock;
    private final ObservabilityService observabilityService;

    public SyncService(AgentProvider provider, Chunker chunker, int concurrency, int fullReIndexThreshold) {
        this(provider, chunker, concurrency, fullReIndexThreshold, Clock.systemUTC(), null);
    }

    public SyncService(
        AgentProvider provider,
        Chunker chunker,
        int concurrency,
        int fullReIndexThreshold,
        Clock clock,
        ObservabilityService observabilityService
    ) {
        this.provider = Objects.requireNonNull(provider, "provider must not be null");
        this.chunker = Objects.requireNonNull(chunker, "chunker must not be null");
        this.planner = new SyncPlanner();
        this.concurrency = Math.max(1, concurrency);
        this.fullReIndexThreshold = fullReIndexThreshold;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.observabilityService = observabilityService;
    }

    public SyncResult sync(AgentState agent, List<String> changedFiles, String headCommit, FileSource files)
        throws IOException {
        Instant started = clock.instant();
        try {
            SyncResult result = apply(agent, changedFiles, headCommit, files);
            emit(ObservabilityService.SYNC_SUCCEEDED, agent, started, result, null);
            return result;
        } catch (IOException | RuntimeException e) {
            emit(ObservabilityService.SYNC_FAILED, agent, started, null, e);
            throw e;
        }
    }

    private SyncResult apply(AgentState agent, List<String> changedFiles, String headCommit, FileSource files)
        throws IOException {
        SyncPlan plan = planner.computePlan(agent.passages(), changedFiles, fullReIndexThreshold);
        LOG.debug(
            "Sync plan for {}: {} passages to delete, {} files to re-index, full={}",
            agent.repoName(),
            plan.passagesToDelete().size(),
            plan.filesToReIndex().size(),
            plan.isFullReIndex()
        );

        List<BoundedExecution.RemoteCall<Void>> deletions = new ArrayList<>();
        for (String passageId : plan.passagesToDelete()) {
            deletions.add(() -> {
                provider.deletePassage(agent.agentId(), passageId);
                return null;
            });
        }
        BoundedExecution.runAll(deletions, concurrency);

        PassageMap updated = agent.passages().withoutFiles(changedFiles);

        // read sequentially, store concurrently; the map is filled in file order
        Map<String, List<Chunk>> chunksByFile = new LinkedHashMap<>();
        for (String path : plan.filesToReIndex()) {
            if (chunksByFile.containsKey(path)) {
                continue;
            }
            Optional<FileInfo> file = files.read(path);
            if (file.isEmpty()) {
                continue;
            }
            chunksByFile.put(path, chunker.chunk(path, file.get().content()));
        }

        List<Chunk> allChunks = new ArrayList<>();
        chunksByFile.values().forEach(allChunks::addAll);
        PassageMap stored = new PassageLoader(provider, concurrency).load(agent.agentId(), allChunks);
        for (String path : stored.files()) {
            updated = updated.withFile(path, stored.passageIds(path));
        }

        int reIndexed = chunksByFile.size();
        return new SyncResult(
            updated,
            headCommit,
            changedFiles.size() - reIndexed,
            reIndexed,
            plan.passagesToDelete().size(),
            allChunks.size(),
            plan.isFullReIndex()
        );
    }

    private void emit(String type, AgentState agent, Instant started, SyncResult result, Exception error) {
        if (observabilityService == null) {
            return;
        }
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("repo", agent.repoName());
        attributes.put("duration_ms", Duration.between(started, clock.instant()).toMillis());
        if (result != null) {
            attributes.put("commit", result.lastSyncCommit() == null ? "" : result.lastSyncCommit());
            attributes.put("files_reindexed", result.filesReIndexed());
            attributes.put("files_deleted", result.filesDeleted());
            attributes.put("full_reindex", result.isFullReIndex());
        }
        if (error != null) {
            attributes.put("error_class", error.getClass().getSimpleName());
        }
        observabilityService.recordQuietly(type, attributes);
    }
}
