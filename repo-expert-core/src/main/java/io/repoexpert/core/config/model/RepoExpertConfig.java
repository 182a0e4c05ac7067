package io.repoexpert.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RepoExpertConfig(
    LettaConfig letta,
    RepoDefaults defaults,
    AskConfig ask,
    Map<String, RepoConfig> repos
) {
    public RepoExpertConfig {
        repos = repos == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(repos));
    }

    public static RepoExpertConfig defaultConfig() {
        return new RepoExpertConfig(
            LettaConfig.defaults(),
            RepoDefaults.defaults(),
            AskConfig.defaults(),
            Map.of()
        );
    }

    public RepoExpertConfig withLetta(LettaConfig updated) {
        return new RepoExpertConfig(updated, defaults, ask, repos);
    }
}
