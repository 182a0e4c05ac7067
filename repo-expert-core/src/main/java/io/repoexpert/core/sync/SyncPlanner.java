package io.repoexpert.core.sync;

import io.repoexpert.core.passage.PassageMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Works out which passages a set of changed files invalidates.
 * Stateless; safe to share.
 */
public final class SyncPlanner {
    public static final int DEFAULT_FULL_REINDEX_THRESHOLD = 500;

    public SyncPlan computePlan(PassageMap passages, List<String> changedFiles) {
        return computePlan(passages, changedFiles, DEFAULT_FULL_REINDEX_THRESHOLD);
    }

    /**
     * @param fullReIndexThreshold changed-file count above which the plan is flagged as a
     *     full re-index
     */
    public SyncPlan computePlan(PassageMap passages, List<String> changedFiles, int fullReIndexThreshold) {
        Objects.requireNonNull(passages, "passages must not be null");
        Objects.requireNonNull(changedFiles, "changedFiles must not be null");

        List<String> passagesToDelete = new ArrayList<>();
        for (String file : changedFiles) {
            passagesToDelete.addAll(passages.passageIds(file));
        }
        return new SyncPlan(passagesToDelete, changedFiles, changedFiles.size() > fullReIndexThreshold);
    }
}
