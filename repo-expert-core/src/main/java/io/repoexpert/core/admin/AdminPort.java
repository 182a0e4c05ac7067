package io.repoexpert.core.admin;

import io.repoexpert.core.provider.AgentSummary;
import io.repoexpert.core.provider.Passage;
import java.io.IOException;
import java.util.List;

/**
 * Read-only inspection of remote agents, used by status and diagnostics.
 */
public interface AdminPort {
    List<AgentSummary> listAgents() throws IOException;

    List<CoreMemoryBlock> getCoreMemory(String agentId) throws IOException;

    List<Passage> searchPassages(String agentId, String query, int limit) throws IOException;
}
