package io.repoexpert.core.reconcile;

import io.repoexpert.core.observability.ObservabilityService;
import io.repoexpert.core.passage.PassageMap;
import io.repoexpert.core.provider.AgentProvider;
import io.repoexpert.core.provider.Passage;
import io.repoexpert.core.state.AgentState;
import io.repoexpert.core.sync.BoundedExecution;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fetches remote passages, reports drift against the local map and repairs it on request.
 */
public final class ReconcileService {
    private static final Logger LOG = LoggerFactory.getLogger(ReconcileService.class);

    private final AgentProvider provider;
    private final Reconciler reconciler;
    private final int concurrency;
    private final ObservabilityService observabilityService;

    public ReconcileService(AgentProvider provider, int concurrency) {
        this(provider, concurrency, null);
    }

    public ReconcileService(AgentProvider provider, int concurrency, ObservabilityService observabilityService) {
        this.provider = Objects.requireNonNull(provider, "provider must not be null");
        this.reconciler = new Reconciler();
        this.concurrency = Math.max(1, concurrency);
        this.observabilityService = observabilityService;
    }

    public ReconcileReport reconcile(AgentState agent) throws IOException {
        List<Passage> serverPassages = provider.listPassages(agent.agentId());
        ReconcilePlan plan = reconciler.computeReconcilePlan(agent.passages(), serverPassages);
        ReconcileReport report = new ReconcileReport(
            agent.repoName(),
            agent.passages().passageCount(),
            serverPassages.size(),
            plan
        );
        if (!plan.inSync()) {
            LOG.info(
                "Drift for {}: {} orphan and {} missing passages",
                agent.repoName(),
                plan.orphanPassageIds().size(),
                plan.missingPassageIds().size()
            );
        }
        emit(report);
        return report;
    }

    /**
     * Deletes orphan passages from the server and drops missing ones from the local map.
     * An orphan that cannot be deleted is logged and reported; it does not stop the repair.
     */
    public DriftRepair fixDrift(AgentState agent, ReconcilePlan plan) throws IOException {
        List<BoundedExecution.RemoteCall<String>> deletions = new ArrayList<>();
        for (String orphanId : plan.orphanPassageIds()) {
            deletions.add(() -> {
                try {
                    provider.deletePassage(agent.agentId(), orphanId);
                    return null;
                } catch (IOException e) {
                    LOG.warn("Failed to delete orphan passage {} of {}: {}", orphanId, agent.repoName(), e.getMessage());
                    return orphanId;
                }
            });
        }
        List<String> failed = BoundedExecution.runAll(deletions, concurrency).stream()
            .filter(Objects::nonNull)
            .toList();

        PassageMap cleaned = reconciler.cleanMissingFromMap(agent.passages(), plan.missingPassageIds());
        return new DriftRepair(cleaned, plan.orphanPassageIds().size() - failed.size(), failed);
    }

    private void emit(ReconcileReport report) {
        if (observabilityService == null) {
            return;
        }
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("repo", report.repoName());
        attributes.put("in_sync", report.inSync());
        attributes.put("orphans", report.plan().orphanPassageIds().size());
        attributes.put("missing", report.plan().missingPassageIds().size());
        observabilityService.recordQuietly(ObservabilityService.RECONCILE, attributes);
    }
}
