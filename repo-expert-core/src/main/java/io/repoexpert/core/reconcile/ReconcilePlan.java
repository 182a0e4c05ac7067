package io.repoexpert.core.reconcile;

import java.util.List;

/**
 * Drift between the local passage map and the remote store.
 *
 * @param orphanPassageIds passages on the server that no local file claims
 * @param missingPassageIds passages the local map records but the server no longer has
 */
public record ReconcilePlan(List<String> orphanPassageIds, List<String> missingPassageIds, boolean inSync) {
    public ReconcilePlan {
        orphanPassageIds = orphanPassageIds == null ? List.of() : List.copyOf(orphanPassageIds);
        missingPassageIds = missingPassageIds == null ? List.of() : List.copyOf(missingPassageIds);
    }
}
