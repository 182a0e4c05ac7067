package io.repoexpert.core.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link AgentProvider} backed by the Letta REST API.
 *
 * <p>Transient failures (HTTP 429/500/502/503 and network errors) are retried with
 * exponential backoff and jitter. A {@code Retry-After} header below five minutes
 * replaces the computed delay.
 */
public final class LettaProvider implements AgentProvider {
    private static final Logger LOG = LoggerFactory.getLogger(LettaProvider.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final int PAGE_SIZE = 1000;
    private static final String NOT_YET_ANALYZED = "Not yet analyzed.";

    private final HttpUrl apiBase;
    private final String apiKey;
    private final OkHttpClient client;
    private final ObjectMapper mapper;
    private final int maxRetries;
    private final Duration retryBaseDelay;

    public LettaProvider(String apiBase, String apiKey) {
        this(apiBase, apiKey, 3, Duration.ofSeconds(1));
    }

    public LettaProvider(String apiBase, String apiKey, int maxRetries, Duration retryBaseDelay) {
        this.apiBase = HttpUrl.get(Objects.requireNonNull(apiBase, "apiBase must not be null"));
        this.apiKey = apiKey == null ? "" : apiKey;
        this.maxRetries = Math.max(0, maxRetries);
        this.retryBaseDelay = retryBaseDelay == null ? Duration.ZERO : retryBaseDelay;
        this.client = new OkHttpClient.Builder()
            .connectTimeout(Duration.ofSeconds(20))
            .readTimeout(Duration.ofSeconds(120))
            .writeTimeout(Duration.ofSeconds(20))
            .build();
        this.mapper = new ObjectMapper();
    }

    @Override
    public String name() {
        return "letta";
    }

    @Override
    public String createAgent(CreateAgentRequest request) throws IOException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("name", request.name());
        payload.put("model", request.model());
        payload.put("embedding", request.embedding());
        payload.put("enable_sleeptime", true);
        payload.put("tools", List.of("archival_memory_search"));
        payload.put("tags", request.tags());
        payload.put("memory_blocks", List.of(
            block(MemoryBlockLabels.PERSONA, request.persona(), request.memoryBlockLimit()),
            block(MemoryBlockLabels.ARCHITECTURE, NOT_YET_ANALYZED, request.memoryBlockLimit()),
            block(MemoryBlockLabels.CONVENTIONS, NOT_YET_ANALYZED, request.memoryBlockLimit())
        ));

        JsonNode agent = execute(post(url("agents"), payload));
        return requiredText(agent, "id", "createAgent");
    }

    @Override
    public void deleteAgent(String agentId) throws IOException {
        execute(delete(url("agents", agentId)));
    }

    @Override
    public List<AgentSummary> listAgents() throws IOException {
        JsonNode agents = execute(get(url("agents")));
        List<AgentSummary> out = new ArrayList<>();
        for (JsonNode agent : agents) {
            String id = agent.path("id").asText("");
            if (id.isBlank()) {
                continue;
            }
            out.add(new AgentSummary(
                id,
                agent.path("name").asText(""),
                agent.path("description").asText(""),
                agent.path("model").asText("")
            ));
        }
        return out;
    }

    @Override
    public List<Passage> listPassages(String agentId) throws IOException {
        List<Passage> all = new ArrayList<>();
        String cursor = null;
        while (true) {
            HttpUrl.Builder builder = url("agents", agentId, "archival-memory").newBuilder()
                .addQueryParameter("limit", String.valueOf(PAGE_SIZE))
                .addQueryParameter("ascending", "true");
            if (cursor != null) {
                builder.addQueryParameter("after", cursor);
            }
            JsonNode page = execute(get(builder.build()));
            if (!page.isArray()) {
                throw new ProviderResponseException("listPassages expected an array for agent " + agentId);
            }

            String lastId = null;
            for (JsonNode item : page) {
                String id = item.path("id").asText("");
                if (!id.isBlank()) {
                    all.add(new Passage(id, item.path("text").asText("")));
                    lastId = id;
                }
            }
            if (page.size() < PAGE_SIZE || lastId == null) {
                break;
            }
            cursor = lastId;
        }
        return all;
    }

    @Override
    public String storePassage(String agentId, String text) throws IOException {
        JsonNode created = execute(post(url("agents", agentId, "archival-memory"), Map.of("text", text)));
        JsonNode first = created.isArray() ? created.path(0) : created;
        String id = first.path("id").asText("");
        if (id.isBlank()) {
            throw new ProviderResponseException("storePassage returned no valid passage ID for agent " + agentId);
        }
        return id;
    }

    @Override
    public void deletePassage(String agentId, String passageId) throws IOException {
        try {
            execute(delete(url("agents", agentId, "archival-memory", passageId)));
        } catch (ProviderHttpException e) {
            if (!e.notFound()) {
                throw e;
            }
            LOG.debug("Passage {} of agent {} already deleted", passageId, agentId);
        }
    }

    @Override
    public String sendMessage(String agentId, String content, SendMessageOptions options) throws IOException {
        SendMessageOptions safe = options == null ? SendMessageOptions.DEFAULTS : options;
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("messages", List.of(Map.of("role", "user", "content", content)));
        if (safe.overrideModel() != null && !safe.overrideModel().isBlank()) {
            payload.put("override_model", safe.overrideModel());
        }
        if (safe.maxSteps() != null) {
            payload.put("max_steps", safe.maxSteps());
        }

        JsonNode response = execute(post(url("agents", agentId, "messages"), payload));
        for (JsonNode message : response.path("messages")) {
            if ("assistant_message".equals(message.path("message_type").asText())) {
                JsonNode text = message.path("content");
                return text.isTextual() ? text.asText() : "";
            }
        }
        return "";
    }

    @Override
    public MemoryBlock getBlock(String agentId, String label) throws IOException {
        JsonNode block = execute(get(url("agents", agentId, "core-memory", "blocks", label)));
        if (!block.has("value")) {
            throw new ProviderResponseException("Block " + label + " of agent " + agentId + " has no value");
        }
        return new MemoryBlock(block.path("value").asText(""), block.path("limit").asInt(0));
    }

    private JsonNode execute(Request request) throws IOException {
        for (int attempt = 0; ; attempt++) {
            try {
                return executeOnce(request);
            } catch (ProviderHttpException e) {
                if (!e.transientFailure() || attempt >= maxRetries) {
                    throw e;
                }
                Duration delay = e.retryAfter().orElse(backoff(attempt));
                LOG.debug("Retrying {} {} after HTTP {} (attempt {})", request.method(), request.url(), e.statusCode(), attempt + 1);
                sleep(jitter(delay));
            } catch (ProviderResponseException | InterruptedIOException e) {
                throw e;
            } catch (IOException e) {
                if (attempt >= maxRetries) {
                    throw e;
                }
                LOG.debug("Retrying {} {} after {} (attempt {})", request.method(), request.url(), e.getMessage(), attempt + 1);
                sleep(jitter(backoff(attempt)));
            }
        }
    }

    private JsonNode executeOnce(Request request) throws IOException {
        try (Response response = client.newCall(request).execute()) {
            ResponseBody body = response.body();
            String raw = body == null ? "" : body.string();
            if (!response.isSuccessful()) {
                throw new ProviderHttpException(response.code(), truncate(raw, 300), retryAfter(response));
            }
            if (raw.isBlank()) {
                return mapper.createObjectNode();
            }
            try {
                return mapper.readTree(raw);
            } catch (IOException e) {
                throw new ProviderResponseException("Malformed response from " + request.url(), e);
            }
        }
    }

    private Duration retryAfter(Response response) {
        String raw = response.header("Retry-After");
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            long seconds = Long.parseLong(raw.trim());
            return seconds > 0 && seconds < 300 ? Duration.ofSeconds(seconds) : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private Duration backoff(int attempt) {
        return retryBaseDelay.multipliedBy(1L << Math.min(attempt, 10));
    }

    private Duration jitter(Duration delay) {
        double factor = 0.5 + ThreadLocalRandom.current().nextDouble() * 0.5;
        return Duration.ofMillis((long) (delay.toMillis() * factor));
    }

    private void sleep(Duration delay) throws InterruptedIOException {
        if (delay.isZero() || delay.isNegative()) {
            return;
        }
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while waiting to retry");
        }
    }

    private HttpUrl url(String... segments) {
        HttpUrl.Builder builder = apiBase.newBuilder();
        for (String segment : segments) {
            builder.addPathSegment(segment);
        }
        return builder.build();
    }

    private Request get(HttpUrl url) {
        return authorized(new Request.Builder().url(url).get()).build();
    }

    private Request delete(HttpUrl url) {
        return authorized(new Request.Builder().url(url).delete()).build();
    }

    private Request post(HttpUrl url, Object payload) throws IOException {
        RequestBody body = RequestBody.create(mapper.writeValueAsString(payload), JSON);
        return authorized(new Request.Builder().url(url).post(body)).build();
    }

    private Request.Builder authorized(Request.Builder builder) {
        builder.header("Accept", "application/json");
        if (!apiKey.isBlank()) {
            builder.header("Authorization", "Bearer " + apiKey);
        }
        return builder;
    }

    private Map<String, Object> block(String label, String value, int limit) {
        Map<String, Object> block = new LinkedHashMap<>();
        block.put("label", label);
        block.put("value", value == null ? "" : value);
        block.put("limit", limit);
        return block;
    }

    private String requiredText(JsonNode node, String field, String operation) throws ProviderResponseException {
        String value = node.path(field).asText("");
        if (value.isBlank()) {
            throw new ProviderResponseException(operation + " response is missing '" + field + "'");
        }
        return value;
    }

    private String truncate(String value, int max) {
        if (value == null) {
            return "";
        }
        if (value.length() <= max) {
            return value;
        }
        return value.substring(0, max) + "...";
    }
}
