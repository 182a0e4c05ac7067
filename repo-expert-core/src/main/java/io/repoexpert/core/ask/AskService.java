package io.repoexpert.core.ask;

import io.repoexpert.core.cache.AnswerCache;
import io.repoexpert.core.cache.AnswerCacheKey;
import io.repoexpert.core.observability.ObservabilityService;
import io.repoexpert.core.provider.AgentProvider;
import io.repoexpert.core.provider.SendMessageOptions;
import io.repoexpert.core.state.AgentState;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Answers questions about a repository through its agent.
 *
 * <p>Answers are cached per agent, model and sync commit, so a sync that moves the commit
 * makes older answers unreachable. Questions routed to the fast model fall back to the
 * agent's default model when the fast attempt fails, times out or comes back empty.
 */
public final class AskService implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(AskService.class);

    private final AgentProvider provider;
    private final AnswerCache cache;
    private final AskRouter router;
    private final Clock clock;
    private final ObservabilityService observabilityService;
    private final ExecutorService executor;

    public AskService(AgentProvider provider, AnswerCache cache, AskRouter router, Clock clock) {
        this(provider, cache, router, clock, null);
    }

    public AskService(
        AgentProvider provider,
        AnswerCache cache,
        AskRouter router,
        Clock clock,
        ObservabilityService observabilityService
    ) {
        this.provider = Objects.requireNonNull(provider, "provider must not be null");
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
        this.router = Objects.requireNonNull(router, "router must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.observabilityService = observabilityService;
        this.executor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "ask-worker");
            thread.setDaemon(true);
            return thread;
        });
    }

    public AskResult ask(AgentState agent, String question, AskOptions options) throws IOException {
        Objects.requireNonNull(agent, "agent must not be null");
        if (question == null || question.isBlank()) {
            throw new IllegalArgumentException("question must not be blank");
        }
        AskOptions safe = options == null ? AskOptions.defaults() : options;
        Instant started = clock.instant();

        AskRoutePlan plan = routePlan(question, safe);
        if (safe.useCache()) {
            Optional<AskResult> cached = cached(agent, question, plan);
            if (cached.isPresent()) {
                LOG.debug("Answer cache hit for {}", agent.repoName());
                emit(agent, started, cached.get());
                return cached.get();
            }
        }

        AskResult result;
        try {
            String answer = send(agent, question, plan.primaryOverrideModel(), plan.primaryTimeout());
            if (answer.isBlank() && plan.enableFallback()) {
                result = fallback(agent, question, plan, "empty answer");
            } else {
                result = new AskResult(answer, false, plan.primaryOverrideModel(), false);
            }
        } catch (IOException e) {
            if (!plan.enableFallback()) {
                throw e;
            }
            result = fallback(agent, question, plan, e.getMessage());
        }

        if (safe.useCache() && !result.answer().isBlank()) {
            cache.set(key(agent, question, result.model()), result.answer());
        }
        emit(agent, started, result);
        return result;
    }

    /**
     * Looks up the primary model's slot, then the default model's slot when the plan may fall
     * back to it, so a repeated question does not retry a failing fast model.
     */
    private Optional<AskResult> cached(AgentState agent, String question, AskRoutePlan plan) {
        String primary = plan.primaryOverrideModel();
        Optional<String> hit = cache.get(key(agent, question, primary));
        if (hit.isPresent()) {
            return Optional.of(new AskResult(hit.get(), true, primary, false));
        }
        if (plan.enableFallback() && primary != null) {
            return cache.get(key(agent, question, null)).map(answer -> new AskResult(answer, true, null, true));
        }
        return Optional.empty();
    }

    private AskRoutePlan routePlan(String question, AskOptions options) {
        if (options.model() != null && !options.model().isBlank()) {
            AskRoutePlan base = router.plan(AskRoutingMode.QUALITY, question, null);
            return new AskRoutePlan(options.model().trim(), base.primaryTimeout(), base.fallbackTimeout(), false);
        }
        return router.plan(options.routing(), question, options.fastModel());
    }

    private AskResult fallback(AgentState agent, String question, AskRoutePlan plan, String reason) throws IOException {
        LOG.info("Fast model {} failed for {} ({}); retrying with the default model", plan.primaryOverrideModel(), agent.repoName(), reason);
        String answer = send(agent, question, null, plan.fallbackTimeout());
        return new AskResult(answer, false, null, true);
    }

    private String send(AgentState agent, String question, String model, Duration timeout) throws IOException {
        Future<String> pending = executor.submit(
            () -> provider.sendMessage(agent.agentId(), question, SendMessageOptions.withModel(model))
        );
        try {
            String answer = pending.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return answer == null ? "" : answer;
        } catch (TimeoutException e) {
            pending.cancel(true);
            throw new IOException("Agent did not answer within " + timeout.toSeconds() + "s", e);
        } catch (InterruptedException ie) {
            pending.cancel(true);
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while waiting for the agent");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException io) {
                throw io;
            }
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IOException(cause);
        }
    }

    private AnswerCacheKey key(AgentState agent, String question, String model) {
        return new AnswerCacheKey(agent.agentId(), question, model, agent.lastSyncCommit());
    }

    private void emit(AgentState agent, Instant started, AskResult result) {
        if (observabilityService == null) {
            return;
        }
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("repo", agent.repoName());
        attributes.put("cache_hit", result.cacheHit());
        attributes.put("fell_back", result.fellBack());
        attributes.put("model", AnswerCacheKey.toModelKey(result.model()));
        attributes.put("duration_ms", Duration.between(started, clock.instant()).toMillis());
        observabilityService.recordQuietly(ObservabilityService.ASK, attributes);
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
