package io.repoexpert.core.ask;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.repoexpert.core.cache.InMemoryAnswerCache;
import io.repoexpert.core.observability.InMemoryAuditStore;
import io.repoexpert.core.observability.ObservabilityService;
import io.repoexpert.core.passage.PassageMap;
import io.repoexpert.core.provider.InMemoryAgentProvider;
import io.repoexpert.core.provider.ProviderHttpException;
import io.repoexpert.core.provider.SendMessageOptions;
import io.repoexpert.core.state.AgentState;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class AskServiceTest {

    private final Clock clock = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);
    private final InMemoryAgentProvider provider = new InMemoryAgentProvider();
    private final InMemoryAnswerCache cache = new InMemoryAnswerCache(Duration.ofSeconds(180), clock);
    private final ObservabilityService observability = new ObservabilityService(new InMemoryAuditStore(), clock);
    private final AskService service = new AskService(
        provider,
        cache,
        new AskRouter(Duration.ofSeconds(5), Duration.ofMillis(200)),
        clock,
        observability
    );

    @AfterEach
    void tearDown() {
        service.close();
    }

    @Test
    void shouldServeRepeatedQuestionFromCache() throws Exception {
        provider.reply("Auth lives in src/auth.");

        AskResult first = service.ask(agent("c1"), "How does auth work?", AskOptions.defaults());
        AskResult second = service.ask(agent("c1"), "  how does AUTH work? ", AskOptions.defaults());

        assertThat(first.cacheHit()).isFalse();
        assertThat(second.cacheHit()).isTrue();
        assertThat(second.answer()).isEqualTo("Auth lives in src/auth.");
        assertThat(provider.sentMessages()).hasSize(1);
        assertThat(observability.summary().asks()).isEqualTo(2);
        assertThat(observability.summary().askCacheHits()).isEqualTo(1);
        assertThat(observability.recent(5)).allSatisfy(event -> assertThat(event.attributes())
            .containsOnlyKeys("repo", "cache_hit", "fell_back", "model", "duration_ms")
            .containsEntry("model", "__agent_default__"));
    }

    @Test
    void shouldMissCacheAfterCommitMoves() throws Exception {
        provider.reply("old").reply("new");

        service.ask(agent("c1"), "Where is main?", AskOptions.defaults());
        AskResult afterSync = service.ask(agent("c2"), "Where is main?", AskOptions.defaults());

        assertThat(afterSync.cacheHit()).isFalse();
        assertThat(afterSync.answer()).isEqualTo("new");
    }

    @Test
    void shouldFallBackToDefaultModelWhenFastModelFails() throws Exception {
        provider.fail(new ProviderHttpException(502, "bad gateway")).reply("from default");

        AskResult result = service.ask(agent("c1"), "Where is main?", new AskOptions(null, AskRoutingMode.AUTO, "fast", true));

        assertThat(result.fellBack()).isTrue();
        assertThat(result.answer()).isEqualTo("from default");
        assertThat(provider.sentOptions()).extracting(SendMessageOptions::overrideModel).containsExactly("fast", null);
    }

    @Test
    void shouldServeRepeatedQuestionFromFallbackAnswer() throws Exception {
        provider.fail(new ProviderHttpException(502, "bad gateway")).reply("from default");
        AskOptions options = new AskOptions(null, AskRoutingMode.AUTO, "fast", true);

        service.ask(agent("c1"), "Where is main?", options);
        AskResult second = service.ask(agent("c1"), "where is MAIN?", options);

        assertThat(second.cacheHit()).isTrue();
        assertThat(second.fellBack()).isTrue();
        assertThat(second.answer()).isEqualTo("from default");
        assertThat(provider.sentMessages()).hasSize(2);
        assertThat(cache.size()).isEqualTo(1);
    }

    @Test
    void shouldFallBackWhenFastModelTimesOut() throws Exception {
        provider.hang(2_000).reply("from default");

        AskResult result = service.ask(agent("c1"), "Where is main?", new AskOptions(null, AskRoutingMode.SPEED, "fast", false));

        assertThat(result.fellBack()).isTrue();
        assertThat(result.answer()).isEqualTo("from default");
    }

    @Test
    void shouldPropagateFailureWithoutFallback() {
        provider.fail(new ProviderHttpException(500, "down"));

        assertThatThrownBy(() -> service.ask(agent("c1"), "Where is main?", new AskOptions(null, AskRoutingMode.QUALITY, "fast", true)))
            .isInstanceOf(ProviderHttpException.class);
    }

    @Test
    void shouldUseExplicitModelWithoutRouting() throws Exception {
        provider.reply("answer");

        AskResult result = service.ask(agent("c1"), "Where is main?", new AskOptions("big-model", AskRoutingMode.SPEED, "fast", true));

        assertThat(result.model()).isEqualTo("big-model");
        assertThat(provider.sentOptions()).extracting(SendMessageOptions::overrideModel).containsExactly("big-model");
    }

    @Test
    void shouldNotCacheEmptyAnswers() throws Exception {
        provider.reply("").reply("second try");

        service.ask(agent("c1"), "Where is main?", AskOptions.defaults());
        AskResult retry = service.ask(agent("c1"), "Where is main?", AskOptions.defaults());

        assertThat(retry.cacheHit()).isFalse();
        assertThat(retry.answer()).isEqualTo("second try");
        assertThat(cache.size()).isEqualTo(1);
    }

    private AgentState agent(String commit) {
        return AgentState.created("agent-1", "demo", clock.instant()).withSync(PassageMap.empty(), commit, clock.instant());
    }
}
