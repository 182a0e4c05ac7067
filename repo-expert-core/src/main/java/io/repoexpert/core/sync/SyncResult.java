package io.repoexpert.core.sync;

import io.repoexpert.core.passage.PassageMap;

public record SyncResult(
    PassageMap passages,
    String lastSyncCommit,
    int filesDeleted,
    int filesReIndexed,
    int passagesDeleted,
    int passagesStored,
    boolean isFullReIndex
) {
}
