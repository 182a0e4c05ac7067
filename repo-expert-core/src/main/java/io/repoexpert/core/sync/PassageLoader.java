package io.repoexpert.core.sync;

import io.repoexpert.core.chunk.Chunk;
import io.repoexpert.core.passage.PassageMap;
import io.repoexpert.core.provider.AgentProvider;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Stores chunks as passages and records the returned IDs per file, in chunk order.
 */
public final class PassageLoader {
    private final AgentProvider provider;
    private final int concurrency;

    public PassageLoader(AgentProvider provider, int concurrency) {
        this.provider = Objects.requireNonNull(provider, "provider must not be null");
        this.concurrency = Math.max(1, concurrency);
    }

    public PassageMap load(String agentId, List<Chunk> chunks) throws IOException {
        List<BoundedExecution.RemoteCall<String>> calls = new ArrayList<>(chunks.size());
        for (Chunk chunk : chunks) {
            calls.add(() -> provider.storePassage(agentId, chunk.text()));
        }
        List<String> ids = BoundedExecution.runAll(calls, concurrency);

        Map<String, List<String>> byFile = new LinkedHashMap<>();
        for (int i = 0; i < chunks.size(); i++) {
            byFile.computeIfAbsent(chunks.get(i).sourcePath(), ignored -> new ArrayList<>()).add(ids.get(i));
        }
        return PassageMap.of(byFile);
    }
}
