package io.repoexpert.core.observability;

import java.time.Instant;
import java.util.Map;

/**
 * One recorded activity. Every event carries a {@code repo} attribute; the rest depend on
 * {@link #type()}:
 * <ul>
 *   <li>{@code sync_succeeded}: {@code duration_ms}, {@code commit}, {@code files_reindexed},
 *       {@code files_deleted}, {@code full_reindex}</li>
 *   <li>{@code sync_failed}: {@code duration_ms}, {@code error_class}</li>
 *   <li>{@code reconcile}: {@code in_sync}, {@code orphans}, {@code missing}</li>
 *   <li>{@code ask}: {@code cache_hit}, {@code fell_back}, {@code model} ({@code "__agent_default__"} when no
 *       model was chosen), {@code duration_ms}</li>
 * </ul>
 * Attribute values are strings, numbers or booleans, so they survive a JSON round trip.
 */
public record AuditEvent(
    String id,
    Instant timestamp,
    String type,
    Map<String, Object> attributes
) {
    public AuditEvent {
        id = id == null ? "" : id.trim();
        timestamp = timestamp == null ? Instant.EPOCH : timestamp;
        type = type == null ? "" : type.trim();
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }
}
