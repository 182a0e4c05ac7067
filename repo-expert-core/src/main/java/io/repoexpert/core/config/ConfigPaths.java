package io.repoexpert.core.config;

import java.nio.file.Path;

public final class ConfigPaths {
    public static final String STATE_FILE = ".repo-expert-state.json";

    private ConfigPaths() {
    }

    public static Path defaultConfigPath() {
        return Path.of(System.getProperty("user.home"), ".repo-expert", "config.json");
    }

    public static Path defaultStatePath() {
        return Path.of(STATE_FILE);
    }

    public static Path defaultAuditPath() {
        return Path.of(System.getProperty("user.home"), ".repo-expert", "audit-events.json");
    }

    public static Path resolve(String rawPath) {
        if (rawPath == null || rawPath.isBlank()) {
            return Path.of(".");
        }
        if (rawPath.startsWith("~/")) {
            return Path.of(System.getProperty("user.home")).resolve(rawPath.substring(2));
        }
        return Path.of(rawPath);
    }
}
