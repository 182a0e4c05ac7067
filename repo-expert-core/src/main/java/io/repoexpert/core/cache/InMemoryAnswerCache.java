package io.repoexpert.core.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Process-local answer cache with lazy expiry.
 *
 * <p>Entries are checked against the clock when read; nothing sweeps in the background.
 * When {@code maxEntries} is positive the least recently used entry is evicted once the
 * bound is exceeded. All access is synchronized on the instance.
 */
public final class InMemoryAnswerCache implements AnswerCache {
    private static final Duration MIN_TTL = Duration.ofMillis(1);

    private final Duration defaultTtl;
    private final Clock clock;
    private final int maxEntries;
    private final LinkedHashMap<AnswerCacheKey.Slot, CacheEntry> store;

    public InMemoryAnswerCache(Duration defaultTtl, Clock clock) {
        this(defaultTtl, clock, 0);
    }

    public InMemoryAnswerCache(Duration defaultTtl, Clock clock, int maxEntries) {
        this.defaultTtl = Objects.requireNonNull(defaultTtl, "defaultTtl must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.maxEntries = Math.max(0, maxEntries);
        this.store = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<AnswerCacheKey.Slot, CacheEntry> eldest) {
                return InMemoryAnswerCache.this.maxEntries > 0 && size() > InMemoryAnswerCache.this.maxEntries;
            }
        };
    }

    @Override
    public synchronized Optional<String> get(AnswerCacheKey key) {
        AnswerCacheKey.Slot slot = key.slot();
        CacheEntry entry = store.get(slot);
        if (entry == null) {
            return Optional.empty();
        }
        if (!entry.expiresAt().isAfter(clock.instant())) {
            store.remove(slot);
            return Optional.empty();
        }
        return Optional.of(entry.answer());
    }

    @Override
    public void set(AnswerCacheKey key, String answer) {
        set(key, answer, defaultTtl);
    }

    @Override
    public synchronized void set(AnswerCacheKey key, String answer, Duration ttl) {
        Objects.requireNonNull(answer, "answer must not be null");
        Duration effective = ttl == null ? defaultTtl : ttl;
        if (effective.compareTo(MIN_TTL) < 0) {
            effective = MIN_TTL;
        }
        store.put(key.slot(), new CacheEntry(answer, clock.instant().plus(effective)));
    }

    @Override
    public synchronized void clear() {
        store.clear();
    }

    /**
     * Number of stored entries, including expired ones not yet read.
     */
    @Override
    public synchronized int size() {
        return store.size();
    }

    record CacheEntry(String answer, Instant expiresAt) {
    }
}
