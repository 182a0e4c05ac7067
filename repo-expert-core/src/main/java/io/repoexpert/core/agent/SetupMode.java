package io.repoexpert.core.agent;

import io.repoexpert.core.state.AgentState;

/**
 * What {@code setup} still has to do for a repository, derived from its saved state.
 */
public enum SetupMode {
    /** No agent yet. */
    CREATE,
    /** Agent exists but was never fully indexed. */
    RESUME_FULL,
    /** Indexed, bootstrap still pending. */
    RESUME_BOOTSTRAP,
    SKIP;

    public static SetupMode of(AgentState agent, boolean bootstrapOnCreate) {
        if (agent == null) {
            return CREATE;
        }
        if (agent.passages().isEmpty() || agent.lastSyncCommit() == null) {
            return RESUME_FULL;
        }
        if (bootstrapOnCreate && agent.lastBootstrap() == null) {
            return RESUME_BOOTSTRAP;
        }
        return SKIP;
    }
}
