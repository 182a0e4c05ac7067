package io.repoexpert.core.admin;

import io.repoexpert.core.provider.AgentProvider;
import io.repoexpert.core.provider.AgentSummary;
import io.repoexpert.core.provider.MemoryBlock;
import io.repoexpert.core.provider.MemoryBlockLabels;
import io.repoexpert.core.provider.Passage;
import io.repoexpert.core.provider.ProviderHttpException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class ProviderAdminAdapter implements AdminPort {
    private static final Logger LOG = LoggerFactory.getLogger(ProviderAdminAdapter.class);

    private final AgentProvider provider;

    public ProviderAdminAdapter(AgentProvider provider) {
        this.provider = Objects.requireNonNull(provider, "provider must not be null");
    }

    @Override
    public List<AgentSummary> listAgents() throws IOException {
        return provider.listAgents();
    }

    /**
     * Blocks the agent does not have are left out.
     */
    @Override
    public List<CoreMemoryBlock> getCoreMemory(String agentId) throws IOException {
        List<CoreMemoryBlock> blocks = new ArrayList<>();
        for (String label : MemoryBlockLabels.STANDARD) {
            try {
                MemoryBlock block = provider.getBlock(agentId, label);
                blocks.add(new CoreMemoryBlock(label, block.value(), block.limit()));
            } catch (ProviderHttpException e) {
                if (!e.notFound()) {
                    throw e;
                }
                LOG.debug("Agent {} has no {} block", agentId, label);
            }
        }
        return blocks;
    }

    /**
     * Case-insensitive substring match over the agent's passages, in server order.
     */
    @Override
    public List<Passage> searchPassages(String agentId, String query, int limit) throws IOException {
        String needle = query == null ? "" : query.toLowerCase(Locale.ROOT);
        List<Passage> matches = new ArrayList<>();
        if (limit <= 0) {
            return matches;
        }
        for (Passage passage : provider.listPassages(agentId)) {
            if (passage.text().toLowerCase(Locale.ROOT).contains(needle)) {
                matches.add(passage);
                if (matches.size() >= limit) {
                    break;
                }
            }
        }
        return matches;
    }
}
