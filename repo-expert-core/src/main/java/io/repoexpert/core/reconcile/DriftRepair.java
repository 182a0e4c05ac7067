package io.repoexpert.core.reconcile;

import io.repoexpert.core.passage.PassageMap;
import java.util.List;

/**
 * @param failedOrphanDeletions orphans the server refused to delete; a later reconcile reports them again
 */
public record DriftRepair(PassageMap passages, int orphansDeleted, List<String> failedOrphanDeletions) {
    public DriftRepair {
        failedOrphanDeletions = failedOrphanDeletions == null ? List.of() : List.copyOf(failedOrphanDeletions);
    }
}
