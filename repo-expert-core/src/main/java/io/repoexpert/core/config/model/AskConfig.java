package io.repoexpert.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AskConfig(
    @JsonAlias({"cache_ttl_seconds"}) int cacheTtlSeconds,
    @JsonAlias({"cache_max_entries"}) int cacheMaxEntries,
    @JsonAlias({"timeout_seconds"}) int timeoutSeconds,
    @JsonAlias({"fast_timeout_seconds"}) int fastTimeoutSeconds,
    @JsonAlias({"fast_model"}) String fastModel,
    String routing
) {

    public static AskConfig defaults() {
        return new AskConfig(180, 1000, 20, 8, "", "auto");
    }
}
