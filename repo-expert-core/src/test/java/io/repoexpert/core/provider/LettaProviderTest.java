package io.repoexpert.core.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class LettaProviderTest {

    private MockWebServer server;
    private LettaProvider provider;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        provider = new LettaProvider(server.url("/v1").toString(), "sk-letta", 2, Duration.ZERO);
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void shouldCreateAgentWithStandardMemoryBlocks() throws Exception {
        server.enqueue(json("{\"id\":\"agent-42\"}"));

        String id = provider.createAgent(new CreateAgentRequest(
            "repo-expert-demo", "demo", "Demo", "I am a codebase expert.", List.of("repo-expert"), "openai/gpt-4.1", "openai/text-embedding-3-small", 5000
        ));

        assertThat(id).isEqualTo("agent-42");
        RecordedRequest request = server.takeRequest();
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getPath()).isEqualTo("/v1/agents");
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer sk-letta");
        String body = request.getBody().readUtf8();
        assertThat(body).contains("\"name\":\"repo-expert-demo\"");
        assertThat(body).contains("\"label\":\"persona\"", "\"label\":\"architecture\"", "\"label\":\"conventions\"");
        assertThat(body).contains("\"archival_memory_search\"");
    }

    @Test
    void shouldPageThroughPassagesWithCursor() throws Exception {
        String firstPage = IntStream.range(0, 1000)
            .mapToObj(i -> "{\"id\":\"p" + i + "\",\"text\":\"t" + i + "\"}")
            .collect(Collectors.joining(",", "[", "]"));
        server.enqueue(json(firstPage));
        server.enqueue(json("[{\"id\":\"p1000\",\"text\":\"last\"}]"));

        List<Passage> passages = provider.listPassages("agent-1");

        assertThat(passages).hasSize(1001);
        assertThat(passages.get(1000).text()).isEqualTo("last");
        assertThat(server.takeRequest().getPath()).isEqualTo("/v1/agents/agent-1/archival-memory?limit=1000&ascending=true");
        assertThat(server.takeRequest().getPath()).endsWith("&after=p999");
    }

    @Test
    void shouldReturnIdOfStoredPassage() throws Exception {
        server.enqueue(json("[{\"id\":\"passage-7\",\"text\":\"FILE: a.ts\"}]"));

        assertThat(provider.storePassage("agent-1", "FILE: a.ts\n\ncode")).isEqualTo("passage-7");
        assertThat(server.takeRequest().getBody().readUtf8()).isEqualTo("{\"text\":\"FILE: a.ts\\n\\ncode\"}");
    }

    @Test
    void shouldRejectStoreResponseWithoutId() {
        server.enqueue(json("[]"));

        assertThatThrownBy(() -> provider.storePassage("agent-1", "text"))
            .isInstanceOf(ProviderResponseException.class)
            .hasMessageContaining("no valid passage ID");
    }

    @Test
    void shouldTreatMissingPassageAsDeleted() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(404).setBody("{\"detail\":\"not found\"}"));

        provider.deletePassage("agent-1", "gone");

        assertThat(server.takeRequest().getPath()).isEqualTo("/v1/agents/agent-1/archival-memory/gone");
    }

    @Test
    void shouldRetryTransientFailures() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(503));
        server.enqueue(new MockResponse().setResponseCode(429).setHeader("Retry-After", "0"));
        server.enqueue(json("{\"messages\":[{\"message_type\":\"reasoning_message\",\"reasoning\":\"...\"},"
            + "{\"message_type\":\"assistant_message\",\"content\":\"It uses JWT.\"}]}"));

        String answer = provider.sendMessage("agent-1", "How does auth work?", SendMessageOptions.withModel("fast"));

        assertThat(answer).isEqualTo("It uses JWT.");
        assertThat(server.getRequestCount()).isEqualTo(3);
        server.takeRequest();
        server.takeRequest();
        assertThat(server.takeRequest().getBody().readUtf8()).contains("\"override_model\":\"fast\"");
    }

    @Test
    void shouldGiveUpAfterMaxRetries() {
        server.enqueue(new MockResponse().setResponseCode(500));
        server.enqueue(new MockResponse().setResponseCode(500));
        server.enqueue(new MockResponse().setResponseCode(500));

        assertThatThrownBy(() -> provider.listAgents())
            .isInstanceOfSatisfying(ProviderHttpException.class, e -> assertThat(e.statusCode()).isEqualTo(500));
        assertThat(server.getRequestCount()).isEqualTo(3);
    }

    @Test
    void shouldNotRetryClientErrors() {
        server.enqueue(new MockResponse().setResponseCode(401).setBody("unauthorized"));

        assertThatThrownBy(() -> provider.getBlock("agent-1", "persona"))
            .isInstanceOf(ProviderHttpException.class)
            .hasMessageContaining("401");
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void shouldReadMemoryBlock() throws Exception {
        server.enqueue(json("{\"label\":\"architecture\",\"value\":\"Layered.\",\"limit\":5000}"));

        MemoryBlock block = provider.getBlock("agent-1", "architecture");

        assertThat(block.value()).isEqualTo("Layered.");
        assertThat(block.limit()).isEqualTo(5000);
        assertThat(server.takeRequest().getPath()).isEqualTo("/v1/agents/agent-1/core-memory/blocks/architecture");
    }

    private MockResponse json(String body) {
        return new MockResponse().setHeader("Content-Type", "application/json").setBody(body);
    }
}
