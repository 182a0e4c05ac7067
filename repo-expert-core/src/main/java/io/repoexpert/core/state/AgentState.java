package io.repoexpert.core.state;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.repoexpert.core.passage.PassageMap;
import java.time.Instant;

/**
 * Everything remembered locally about one repository's agent.
 *
 * @param lastSyncCommit commit the passages reflect, {@code null} before the first sync
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AgentState(
    String agentId,
    String repoName,
    PassageMap passages,
    Instant lastBootstrap,
    String lastSyncCommit,
    Instant lastSyncAt,
    Instant createdAt
) {
    public AgentState {
        passages = passages == null ? PassageMap.empty() : passages;
    }

    public static AgentState created(String agentId, String repoName, Instant createdAt) {
        return new AgentState(agentId, repoName, PassageMap.empty(), null, null, null, createdAt);
    }

    public AgentState withPassages(PassageMap updated) {
        return new AgentState(agentId, repoName, updated, lastBootstrap, lastSyncCommit, lastSyncAt, createdAt);
    }

    public AgentState withSync(PassageMap updated, String commit, Instant syncedAt) {
        return new AgentState(agentId, repoName, updated, lastBootstrap, commit, syncedAt, createdAt);
    }

    public AgentState withBootstrap(Instant bootstrappedAt) {
        return new AgentState(agentId, repoName, passages, bootstrappedAt, lastSyncCommit, lastSyncAt, createdAt);
    }
}
