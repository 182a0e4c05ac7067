package io.repoexpert.core.agent;

import io.repoexpert.core.chunk.Chunk;
import io.repoexpert.core.chunk.Chunker;
import io.repoexpert.core.collect.FileCollector;
import io.repoexpert.core.collect.FileInfo;
import io.repoexpert.core.config.model.LettaConfig;
import io.repoexpert.core.config.model.RepoConfig;
import io.repoexpert.core.config.model.RepoDefaults;
import io.repoexpert.core.passage.PassageMap;
import io.repoexpert.core.provider.AgentProvider;
import io.repoexpert.core.provider.CreateAgentRequest;
import io.repoexpert.core.provider.SendMessageOptions;
import io.repoexpert.core.state.AgentState;
import io.repoexpert.core.state.AppState;
import io.repoexpert.core.state.StateStore;
import io.repoexpert.core.sync.BoundedExecution;
import io.repoexpert.core.sync.PassageLoader;
import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates, indexes and bootstraps repository agents.
 *
 * <p>State is saved after each stage so an interrupted setup resumes where it stopped on the
 * next run.
 */
public final class AgentSetupService {
    private static final Logger LOG = LoggerFactory.getLogger(AgentSetupService.class);
    private static final String AGENT_NAME_PREFIX = "repo-expert-";
    private static final String AGENT_TAG = "repo-expert";

    private final AgentProvider provider;
    private final StateStore stateStore;
    private final LettaConfig letta;
    private final RepoDefaults defaults;
    private final Clock clock;

    public AgentSetupService(
        AgentProvider provider,
        StateStore stateStore,
        LettaConfig letta,
        RepoDefaults defaults,
        Clock clock
    ) {
        this.provider = Objects.requireNonNull(provider, "provider must not be null");
        this.stateStore = Objects.requireNonNull(stateStore, "stateStore must not be null");
        this.letta = letta == null ? LettaConfig.defaults() : letta;
        this.defaults = defaults == null ? RepoDefaults.defaults() : defaults;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * @param headCommit commit the indexed files reflect, {@code null} outside a git checkout
     */
    public SetupResult setup(String repoName, RepoConfig repo, String headCommit) throws IOException {
        Objects.requireNonNull(repoName, "repoName must not be null");
        Objects.requireNonNull(repo, "repo must not be null");

        Optional<AgentState> existing = stateStore.load().agent(repoName);
        SetupMode mode = SetupMode.of(existing.orElse(null), defaults.bootstrapOnCreate());
        LOG.debug("Setup mode for {}: {}", repoName, mode);
        if (mode == SetupMode.SKIP) {
            return new SetupResult(existing.get(), mode, 0, 0, false);
        }

        AgentState agent = existing.orElse(null);
        if (mode == SetupMode.CREATE) {
            agent = create(repoName, repo);
        }

        int filesIndexed = 0;
        int passagesStored = 0;
        if (mode == SetupMode.CREATE || mode == SetupMode.RESUME_FULL) {
            discardPartialIndex(agent);
            List<FileInfo> files = new FileCollector(defaults).collectAll(repo);
            Chunker chunker = new Chunker(defaults.maxChunkSize());
            List<Chunk> chunks = new ArrayList<>();
            for (FileInfo file : files) {
                chunks.addAll(chunker.chunk(file.path(), file.content()));
            }
            LOG.info("Indexing {} files ({} passages) for {}", files.size(), chunks.size(), repoName);
            PassageMap passages = new PassageLoader(provider, defaults.syncConcurrency()).load(agent.agentId(), chunks);
            agent = agent.withSync(passages, headCommit, clock.instant());
            save(agent);
            filesIndexed = passages.fileCount();
            passagesStored = chunks.size();
        }

        boolean bootstrapped = false;
        if (defaults.bootstrapOnCreate() && agent.lastBootstrap() == null) {
            bootstrap(agent.agentId());
            agent = agent.withBootstrap(clock.instant());
            save(agent);
            bootstrapped = true;
        }
        return new SetupResult(agent, mode, filesIndexed, passagesStored, bootstrapped);
    }

    /**
     * Asks the agent to fill its architecture and conventions memory blocks.
     */
    public void bootstrap(String agentId) throws IOException {
        LOG.info("Bootstrapping agent {}", agentId);
        provider.sendMessage(agentId, AgentPrompts.architectureBootstrap(), SendMessageOptions.DEFAULTS);
        provider.sendMessage(agentId, AgentPrompts.conventionsBootstrap(), SendMessageOptions.DEFAULTS);
    }

    /**
     * Deletes the remote agent and forgets it locally.
     */
    public boolean destroy(String repoName) throws IOException {
        AppState state = stateStore.load();
        Optional<AgentState> agent = state.agent(repoName);
        if (agent.isEmpty()) {
            return false;
        }
        provider.deleteAgent(agent.get().agentId());
        stateStore.save(state.withoutAgent(repoName));
        return true;
    }

    private AgentState create(String repoName, RepoConfig repo) throws IOException {
        List<String> tags = new ArrayList<>();
        tags.add(AGENT_TAG);
        tags.addAll(repo.tags());
        CreateAgentRequest request = new CreateAgentRequest(
            AGENT_NAME_PREFIX + repoName,
            repoName,
            repo.description(),
            AgentPrompts.persona(repoName, repo.description(), repo.persona()),
            tags,
            letta.model(),
            letta.embedding(),
            repo.effectiveMemoryBlockLimit(defaults)
        );
        String agentId = provider.createAgent(request);
        LOG.info("Created agent {} for {}", agentId, repoName);
        AgentState agent = AgentState.created(agentId, repoName, clock.instant());
        save(agent);
        return agent;
    }

    private void discardPartialIndex(AgentState agent) throws IOException {
        List<String> stale = new ArrayList<>(agent.passages().allPassageIds());
        if (stale.isEmpty()) {
            return;
        }
        LOG.info("Discarding {} passages from an incomplete index of {}", stale.size(), agent.repoName());
        List<BoundedExecution.RemoteCall<Void>> deletions = new ArrayList<>();
        for (String passageId : stale) {
            deletions.add(() -> {
                provider.deletePassage(agent.agentId(), passageId);
                return null;
            });
        }
        BoundedExecution.runAll(deletions, defaults.syncConcurrency());
    }

    private void save(AgentState agent) throws IOException {
        stateStore.save(stateStore.load().withAgent(agent));
    }
}
