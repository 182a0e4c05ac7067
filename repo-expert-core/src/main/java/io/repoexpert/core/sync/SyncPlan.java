package io.repoexpert.core.sync;

import java.util.List;

public record SyncPlan(
    List<String> passagesToDelete,
    List<String> filesToReIndex,
    boolean isFullReIndex
) {
    public SyncPlan {
        passagesToDelete = passagesToDelete == null ? List.of() : List.copyOf(passagesToDelete);
        filesToReIndex = filesToReIndex == null ? List.of() : List.copyOf(filesToReIndex);
    }
}
