package io.repoexpert.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record LettaConfig(
    @JsonAlias({"base_url"}) String baseUrl,
    @JsonAlias({"api_key"}) String apiKey,
    String model,
    String embedding
) {

    public static LettaConfig defaults() {
        return new LettaConfig(
            "https://api.letta.com/v1",
            "",
            "openai/gpt-4.1",
            "openai/text-embedding-3-small"
        );
    }

    public boolean configured() {
        return apiKey != null && !apiKey.isBlank();
    }

    public LettaConfig withApiKey(String key) {
        return new LettaConfig(baseUrl, key, model, embedding);
    }

    public LettaConfig withBaseUrl(String url) {
        return new LettaConfig(url, apiKey, model, embedding);
    }
}
