package io.repoexpert.core.cache;

import java.time.Duration;
import java.util.Optional;

public interface AnswerCache {
    Optional<String> get(AnswerCacheKey key);

    void set(AnswerCacheKey key, String answer);

    void set(AnswerCacheKey key, String answer, Duration ttl);

    void clear();

    int size();
}
