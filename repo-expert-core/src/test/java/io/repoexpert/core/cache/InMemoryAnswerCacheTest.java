package io.repoexpert.core.cache;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.Test;

class InMemoryAnswerCacheTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));

    @Test
    void shouldExpireEntriesAfterTtl() {
        InMemoryAnswerCache cache = new InMemoryAnswerCache(Duration.ofSeconds(180), clock);
        AnswerCacheKey key = new AnswerCacheKey("agent-1", "How does auth work?", null, "abc123");

        cache.set(key, "A", Duration.ofSeconds(10));
        clock.advance(Duration.ofSeconds(9));
        assertThat(cache.get(key)).contains("A");

        clock.advance(Duration.ofSeconds(1));
        assertThat(cache.get(key)).isEmpty();
        assertThat(cache.size()).isZero();
    }

    @Test
    void shouldMatchNormalizedQuestions() {
        InMemoryAnswerCache cache = new InMemoryAnswerCache(Duration.ofSeconds(180), clock);

        cache.set(new AnswerCacheKey("agent-1", "  How does   AUTH work? ", "", null), "A");

        assertThat(cache.get(new AnswerCacheKey("agent-1", "how does auth work?", null, null))).contains("A");
    }

    @Test
    void shouldKeepSeparateSlotsPerCommitAndModel() {
        InMemoryAnswerCache cache = new InMemoryAnswerCache(Duration.ofSeconds(180), clock);

        cache.set(new AnswerCacheKey("agent-1", "q", null, "c1"), "old");
        cache.set(new AnswerCacheKey("agent-1", "q", null, "c2"), "new");
        cache.set(new AnswerCacheKey("agent-1", "q", "fast-model", "c2"), "fast");

        assertThat(cache.get(new AnswerCacheKey("agent-1", "q", null, "c1"))).contains("old");
        assertThat(cache.get(new AnswerCacheKey("agent-1", "q", null, "c2"))).contains("new");
        assertThat(cache.get(new AnswerCacheKey("agent-1", "q", " fast-model ", "c2"))).contains("fast");
        assertThat(cache.get(new AnswerCacheKey("agent-1", "q", null, null))).isEmpty();
    }

    @Test
    void shouldNotCollideOnSeparatorLikeComponents() {
        InMemoryAnswerCache cache = new InMemoryAnswerCache(Duration.ofSeconds(180), clock);

        cache.set(new AnswerCacheKey("a::b", "q", null, "c"), "first");

        assertThat(cache.get(new AnswerCacheKey("a", "q", "b::__agent_default__", "c"))).isEmpty();
    }

    @Test
    void shouldTreatZeroTtlAsImmediatelyExpiring() {
        InMemoryAnswerCache cache = new InMemoryAnswerCache(Duration.ofSeconds(180), clock);
        AnswerCacheKey key = new AnswerCacheKey("agent-1", "q", null, "c");

        cache.set(key, "A", Duration.ZERO);
        clock.advance(Duration.ofMillis(1));

        assertThat(cache.get(key)).isEmpty();
    }

    @Test
    void shouldEvictLeastRecentlyUsedBeyondBound() {
        InMemoryAnswerCache cache = new InMemoryAnswerCache(Duration.ofSeconds(180), clock, 2);
        AnswerCacheKey first = new AnswerCacheKey("agent-1", "first", null, "c");
        AnswerCacheKey second = new AnswerCacheKey("agent-1", "second", null, "c");
        AnswerCacheKey third = new AnswerCacheKey("agent-1", "third", null, "c");

        cache.set(first, "1");
        cache.set(second, "2");
        cache.get(first);
        cache.set(third, "3");

        assertThat(cache.size()).isEqualTo(2);
        assertThat(cache.get(first)).contains("1");
        assertThat(cache.get(second)).isEmpty();
        assertThat(cache.get(third)).contains("3");
    }

    @Test
    void shouldClearAllEntries() {
        InMemoryAnswerCache cache = new InMemoryAnswerCache(Duration.ofSeconds(180), clock);
        cache.set(new AnswerCacheKey("agent-1", "q", null, "c"), "A");

        cache.clear();

        assertThat(cache.size()).isZero();
    }

    @Test
    void shouldKeepOneOfConcurrentWrites() throws Exception {
        InMemoryAnswerCache cache = new InMemoryAnswerCache(Duration.ofSeconds(180), clock);
        AnswerCacheKey key = new AnswerCacheKey("agent-1", "q", null, "c");
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < 8; i++) {
                String answer = "answer-" + i;
                futures.add(executor.submit(() -> {
                    start.await();
                    cache.set(key, answer);
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(cache.size()).isEqualTo(1);
        assertThat(cache.get(key)).hasValueSatisfying(value -> assertThat(value).startsWith("answer-"));
    }

    private static final class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant start) {
            this.now = start;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
