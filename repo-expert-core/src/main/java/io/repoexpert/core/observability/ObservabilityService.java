package io.repoexpert.core.observability;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Records sync, reconcile and ask activity. Constructed by the application and handed to
 * the services that report to it.
 */
public final class ObservabilityService {
    public static final String SYNC_SUCCEEDED = "sync_succeeded";
    public static final String SYNC_FAILED = "sync_failed";
    public static final String RECONCILE = "reconcile";
    public static final String ASK = "ask";

    private static final Logger LOG = LoggerFactory.getLogger(ObservabilityService.class);
    private static final int MAX_EVENTS = 20_000;

    private final AuditStore store;
    private final Clock clock;

    public ObservabilityService(AuditStore store, Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public synchronized AuditEvent record(String type, Map<String, Object> attributes) throws IOException {
        List<AuditEvent> all = new ArrayList<>(store.load());
        AuditEvent event = new AuditEvent(
            UUID.randomUUID().toString(),
            clock.instant(),
            type,
            attributes
        );
        all.add(event);
        if (all.size() > MAX_EVENTS) {
            all = new ArrayList<>(all.subList(all.size() - MAX_EVENTS, all.size()));
        }
        store.save(all);
        return event;
    }

    /**
     * Like {@link #record} but a storage failure is logged instead of propagated, so a broken
     * audit log never fails the operation being audited.
     */
    public void recordQuietly(String type, Map<String, Object> attributes) {
        try {
            record(type, attributes);
        } catch (IOException e) {
            LOG.warn("Failed to record audit event {}: {}", type, e.getMessage());
        }
    }

    public synchronized List<AuditEvent> recent(int limit) throws IOException {
        int safe = Math.max(1, limit);
        return store.load().stream()
            .sorted(Comparator.comparing(AuditEvent::timestamp).reversed())
            .limit(safe)
            .toList();
    }

    public synchronized ActivitySummary summary() throws IOException {
        List<AuditEvent> all = store.load();

        List<AuditEvent> syncs = byType(all, SYNC_SUCCEEDED);
        List<AuditEvent> syncFailures = byType(all, SYNC_FAILED);
        List<AuditEvent> reconciles = byType(all, RECONCILE);
        List<AuditEvent> asks = byType(all, ASK);

        int filesReIndexed = syncs.stream()
            .map(e -> toDouble(e.attributes().get("files_reindexed")))
            .filter(Objects::nonNull)
            .mapToInt(Double::intValue)
            .sum();
        int drifts = (int) reconciles.stream()
            .filter(e -> Boolean.FALSE.equals(e.attributes().get("in_sync")))
            .count();
        int cacheHits = (int) asks.stream()
            .filter(e -> Boolean.TRUE.equals(e.attributes().get("cache_hit")))
            .count();

        List<Double> latencies = asks.stream()
            .filter(e -> !Boolean.TRUE.equals(e.attributes().get("cache_hit")))
            .map(e -> toDouble(e.attributes().get("duration_ms")))
            .filter(v -> v != null && v >= 0)
            .sorted()
            .toList();

        return new ActivitySummary(
            syncs.size(),
            syncFailures.size(),
            filesReIndexed,
            reconciles.size(),
            drifts,
            asks.size(),
            cacheHits,
            round2(asks.isEmpty() ? 0.0 : cacheHits * 100.0 / asks.size()),
            round2(percentile(latencies, 50)),
            round2(percentile(latencies, 95)),
            all.size()
        );
    }

    private List<AuditEvent> byType(List<AuditEvent> events, String type) {
        return events.stream().filter(e -> type.equalsIgnoreCase(e.type())).toList();
    }

    private Double toDouble(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        try {
            return Double.parseDouble(String.valueOf(value).trim());
        } catch (NumberFormatException ignored) {
            return null;
        }
    }

    private double percentile(List<Double> sorted, int percentile) {
        if (sorted.isEmpty()) {
            return 0.0;
        }
        int index = (int) Math.ceil((percentile / 100.0) * sorted.size()) - 1;
        index = Math.max(0, Math.min(sorted.size() - 1, index));
        return sorted.get(index);
    }

    private double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
