package io.repoexpert.core.reconcile;

import io.repoexpert.core.passage.PassageMap;
import io.repoexpert.core.provider.Passage;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Compares the local passage map with the server's passage list. Pure; performs no I/O.
 */
public final class Reconciler {

    public ReconcilePlan computeReconcilePlan(PassageMap passages, List<Passage> serverPassages) {
        Objects.requireNonNull(passages, "passages must not be null");
        Objects.requireNonNull(serverPassages, "serverPassages must not be null");

        Set<String> localIds = passages.allPassageIds();
        Set<String> serverIds = new LinkedHashSet<>();
        for (Passage passage : serverPassages) {
            serverIds.add(passage.id());
        }

        List<String> orphans = new ArrayList<>();
        for (String id : serverIds) {
            if (!localIds.contains(id)) {
                orphans.add(id);
            }
        }
        List<String> missing = new ArrayList<>();
        for (String id : localIds) {
            if (!serverIds.contains(id)) {
                missing.add(id);
            }
        }
        return new ReconcilePlan(orphans, missing, orphans.isEmpty() && missing.isEmpty());
    }

    /**
     * Drops {@code missingIds} from every file and removes files left without passages.
     * Returns {@code passages} itself when there is nothing to remove.
     */
    public PassageMap cleanMissingFromMap(PassageMap passages, List<String> missingIds) {
        Objects.requireNonNull(passages, "passages must not be null");
        if (missingIds == null || missingIds.isEmpty()) {
            return passages;
        }
        Set<String> missing = new HashSet<>(missingIds);
        Map<String, List<String>> cleaned = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> entry : passages.asMap().entrySet()) {
            List<String> kept = entry.getValue().stream()
                .filter(id -> !missing.contains(id))
                .toList();
            if (!kept.isEmpty()) {
                cleaned.put(entry.getKey(), kept);
            }
        }
        return PassageMap.of(cleaned);
    }
}
