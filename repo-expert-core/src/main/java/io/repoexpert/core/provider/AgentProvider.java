package io.repoexpert.core.provider;

import java.io.IOException;
import java.util.List;

/**
 * Remote agent memory backend. Implementations perform blocking network calls.
 */
public interface AgentProvider {
    String name();

    String createAgent(CreateAgentRequest request) throws IOException;

    void deleteAgent(String agentId) throws IOException;

    List<AgentSummary> listAgents() throws IOException;

    List<Passage> listPassages(String agentId) throws IOException;

    /**
     * @return the ID the server assigned to the new passage
     */
    String storePassage(String agentId, String text) throws IOException;

    /**
     * Deleting a passage that no longer exists is not an error.
     */
    void deletePassage(String agentId, String passageId) throws IOException;

    String sendMessage(String agentId, String content, SendMessageOptions options) throws IOException;

    MemoryBlock getBlock(String agentId, String label) throws IOException;
}
