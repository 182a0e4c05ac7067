package io.repoexpert.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.repoexpert.core.config.model.LettaConfig;
import io.repoexpert.core.config.model.RepoExpertConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Loads the JSON configuration, deep-merged over {@link RepoExpertConfig#defaultConfig()}.
 * {@code LETTA_API_KEY} and {@code LETTA_BASE_URL} override the file when set.
 */
public final class ConfigService {
    private final ObjectMapper mapper;
    private final Map<String, String> environment;

    public ConfigService() {
        this(System.getenv());
    }

    public ConfigService(Map<String, String> environment) {
        this.mapper = new ObjectMapper();
        this.environment = environment == null ? Map.of() : Map.copyOf(environment);
    }

    public RepoExpertConfig load(Path configPath) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        RepoExpertConfig config;
        if (!Files.exists(configPath)) {
            config = RepoExpertConfig.defaultConfig();
        } else {
            JsonNode defaultsNode = mapper.valueToTree(RepoExpertConfig.defaultConfig());
            JsonNode existingNode = mapper.readTree(Files.readString(configPath));
            JsonNode merged = deepMerge(defaultsNode, existingNode);
            config = mapper.treeToValue(merged, RepoExpertConfig.class);
        }
        return applyEnvironment(config);
    }

    public void save(Path configPath, RepoExpertConfig config) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        Objects.requireNonNull(config, "config must not be null");
        Path parent = configPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        Files.writeString(configPath, json + System.lineSeparator());
    }

    public String toPrettyJson(RepoExpertConfig config) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize config", e);
        }
    }

    private RepoExpertConfig applyEnvironment(RepoExpertConfig config) {
        LettaConfig letta = config.letta();
        String apiKey = environment.get("LETTA_API_KEY");
        if (apiKey != null && !apiKey.isBlank()) {
            letta = letta.withApiKey(apiKey.trim());
        }
        String baseUrl = environment.get("LETTA_BASE_URL");
        if (baseUrl != null && !baseUrl.isBlank()) {
            letta = letta.withBaseUrl(baseUrl.trim());
        }
        return letta == config.letta() ? config : config.withLetta(letta);
    }

    private JsonNode deepMerge(JsonNode base, JsonNode override) {
        if (base == null) {
            return override;
        }
        if (override == null) {
            return base;
        }
        if (!base.isObject() || !override.isObject()) {
            return override;
        }

        ObjectNode merged = ((ObjectNode) base).deepCopy();
        override.fields().forEachRemaining(entry -> {
            JsonNode existing = merged.get(entry.getKey());
            merged.set(entry.getKey(), deepMerge(existing, entry.getValue()));
        });
        return merged;
    }
}
