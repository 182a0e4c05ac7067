package io.repoexpert.core.state;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.repoexpert.core.passage.PassageMap;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Persisted state for all agents, keyed by repository name. Immutable.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AppState(Map<String, AgentState> agents) {
    public AppState {
        agents = agents == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(agents));
    }

    public static AppState empty() {
        return new AppState(Map.of());
    }

    public Optional<AgentState> agent(String repoName) {
        return Optional.ofNullable(agents.get(repoName));
    }

    public AppState withAgent(AgentState agent) {
        Map<String, AgentState> copy = new LinkedHashMap<>(agents);
        copy.put(agent.repoName(), agent);
        return new AppState(copy);
    }

    public AppState withPassages(String repoName, PassageMap passages) {
        return update(repoName, agent -> agent.withPassages(passages));
    }

    public AppState withSync(String repoName, PassageMap passages, String commit, Instant syncedAt) {
        return update(repoName, agent -> agent.withSync(passages, commit, syncedAt));
    }

    public AppState withBootstrap(String repoName, Instant bootstrappedAt) {
        return update(repoName, agent -> agent.withBootstrap(bootstrappedAt));
    }

    public AppState withoutAgent(String repoName) {
        Map<String, AgentState> copy = new LinkedHashMap<>(agents);
        copy.remove(repoName);
        return new AppState(copy);
    }

    private AppState update(String repoName, UnaryOperator<AgentState> change) {
        AgentState existing = agents.get(repoName);
        if (existing == null) {
            throw new IllegalArgumentException("No agent found for repo: " + repoName);
        }
        return withAgent(change.apply(existing));
    }
}
