package io.repoexpert.core.observability;

public record ActivitySummary(
    int syncsSucceeded,
    int syncsFailed,
    int filesReIndexed,
    int reconcileRuns,
    int reconcileDrifts,
    int asks,
    int askCacheHits,
    double askCacheHitRate,
    double p50AskLatencyMs,
    double p95AskLatencyMs,
    int auditEvents
) {
}
