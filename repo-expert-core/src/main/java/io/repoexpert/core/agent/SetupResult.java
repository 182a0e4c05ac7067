package io.repoexpert.core.agent;

import io.repoexpert.core.state.AgentState;

public record SetupResult(AgentState agent, SetupMode mode, int filesIndexed, int passagesStored, boolean bootstrapped) {
}
