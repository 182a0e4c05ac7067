package io.repoexpert.core.reconcile;

public record ReconcileReport(
    String repoName,
    int localPassageCount,
    int serverPassageCount,
    ReconcilePlan plan
) {
    public boolean inSync() {
        return plan.inSync();
    }
}
