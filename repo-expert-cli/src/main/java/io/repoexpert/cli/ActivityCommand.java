package io.repoexpert.cli;

import io.repoexpert.core.observability.ActivitySummary;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "activity", description = "Summarize recorded sync, reconcile and ask activity")
public final class ActivityCommand implements Callable<Integer> {
    private final CliContext context;

    public ActivityCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            ActivitySummary summary = context.observabilityService().summary();
            System.out.println("Syncs: " + summary.syncsSucceeded() + " succeeded, " + summary.syncsFailed() + " failed");
            System.out.println("Files re-indexed: " + summary.filesReIndexed());
            System.out.println("Reconcile runs: " + summary.reconcileRuns() + " (" + summary.reconcileDrifts() + " with drift)");
            System.out.println("Asks: " + summary.asks() + " (cache hit rate " + summary.askCacheHitRate() + "%)");
            System.out.println("Ask latency p50/p95: " + summary.p50AskLatencyMs() + " / " + summary.p95AskLatencyMs() + " ms");
            return 0;
        } catch (Exception e) {
            System.err.println("Activity command failed: " + e.getMessage());
            return 1;
        }
    }
}
