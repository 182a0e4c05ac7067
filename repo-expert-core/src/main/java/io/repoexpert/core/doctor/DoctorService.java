package io.repoexpert.core.doctor;

import io.repoexpert.core.config.ConfigPaths;
import io.repoexpert.core.config.ConfigService;
import io.repoexpert.core.config.model.RepoConfig;
import io.repoexpert.core.config.model.RepoExpertConfig;
import io.repoexpert.core.git.ChangeDetector;
import io.repoexpert.core.provider.AgentProvider;
import io.repoexpert.core.state.AgentState;
import io.repoexpert.core.state.AppState;
import io.repoexpert.core.state.StateStore;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks the local setup: config file, API key, Letta connectivity, repo paths, agreement
 * between config and state, and the git installation.
 */
public final class DoctorService {
    private static final Logger LOG = LoggerFactory.getLogger(DoctorService.class);

    private final ConfigService configService;
    private final Path configPath;
    private final StateStore stateStore;
    private final AgentProvider provider;
    private final ChangeDetector changeDetector;

    public DoctorService(
        ConfigService configService,
        Path configPath,
        StateStore stateStore,
        AgentProvider provider,
        ChangeDetector changeDetector
    ) {
        this.configService = Objects.requireNonNull(configService, "configService must not be null");
        this.configPath = Objects.requireNonNull(configPath, "configPath must not be null");
        this.stateStore = Objects.requireNonNull(stateStore, "stateStore must not be null");
        this.provider = Objects.requireNonNull(provider, "provider must not be null");
        this.changeDetector = Objects.requireNonNull(changeDetector, "changeDetector must not be null");
    }

    public List<CheckResult> runAllChecks() {
        List<CheckResult> results = new ArrayList<>();
        boolean configExists = Files.isRegularFile(configPath);
        Optional<RepoExpertConfig> config = loadConfig();
        Optional<AppState> state = loadState();

        results.add(checkApiKey(config));
        results.add(checkApiConnection(state));
        if (configExists) {
            results.add(CheckResult.pass("Config file", configPath + " found"));
            if (config.isPresent()) {
                results.addAll(checkRepoPaths(config.get()));
                state.ifPresent(loaded -> results.addAll(checkStateConsistency(config.get(), loaded)));
            } else {
                results.add(CheckResult.warn("Repo paths", "Could not parse config to check repo paths"));
            }
        } else {
            results.add(CheckResult.fail("Config file", configPath + " not found. Create it with a \"repos\" section."));
        }
        results.add(checkGit());
        return results;
    }

    public static String formatReport(List<CheckResult> results) {
        if (results.isEmpty()) {
            return "No checks ran.";
        }
        StringBuilder report = new StringBuilder();
        for (CheckResult result : results) {
            report.append("  ").append(result.status()).append("  ")
                .append(result.name()).append(": ").append(result.message()).append('\n');
        }
        long issues = results.stream().filter(result -> result.status() != CheckStatus.PASS).count();
        report.append('\n');
        if (issues == 0) {
            report.append("All checks passed.");
        } else {
            report.append(issues).append(issues > 1 ? " issues found." : " issue found.");
        }
        return report.toString();
    }

    public static boolean hasFailures(List<CheckResult> results) {
        return results.stream().anyMatch(result -> result.status() == CheckStatus.FAIL);
    }

    private CheckResult checkApiKey(Optional<RepoExpertConfig> config) {
        if (config.isPresent() && config.get().letta().configured()) {
            return CheckResult.pass("API key", "Set");
        }
        return CheckResult.fail("API key", "LETTA_API_KEY not set. Export it or add letta.apiKey to the config.");
    }

    private CheckResult checkApiConnection(Optional<AppState> state) {
        Optional<AgentState> first = state.flatMap(loaded -> loaded.agents().values().stream().findFirst());
        if (first.isEmpty()) {
            return CheckResult.warn("API connection", "No agents yet, run setup to verify the connection");
        }
        try {
            provider.listPassages(first.get().agentId());
            return CheckResult.pass("API connection", "Connected to " + provider.name());
        } catch (IOException | RuntimeException e) {
            LOG.debug("Connection check failed", e);
            return CheckResult.fail("API connection", "Cannot reach the Letta API: " + e.getMessage());
        }
    }

    private List<CheckResult> checkRepoPaths(RepoExpertConfig config) {
        List<CheckResult> results = new ArrayList<>();
        for (Map.Entry<String, RepoConfig> entry : config.repos().entrySet()) {
            String name = "Repo \"" + entry.getKey() + "\"";
            String rawPath = entry.getValue().path();
            if (rawPath == null || rawPath.isBlank()) {
                results.add(CheckResult.fail(name, "no path configured"));
                continue;
            }
            Path path = ConfigPaths.resolve(rawPath);
            if (Files.isDirectory(path)) {
                results.add(CheckResult.pass(name, path.toString()));
            } else if (Files.exists(path)) {
                results.add(CheckResult.fail(name, path + " is not a directory"));
            } else {
                results.add(CheckResult.fail(name, path + " does not exist"));
            }
        }
        return results;
    }

    private List<CheckResult> checkStateConsistency(RepoExpertConfig config, AppState state) {
        List<CheckResult> results = new ArrayList<>();
        for (String repoName : state.agents().keySet()) {
            if (!config.repos().containsKey(repoName)) {
                results.add(CheckResult.warn("State consistency", "Agent \"" + repoName + "\" in state but not in config (orphaned)"));
            }
        }
        for (String repoName : config.repos().keySet()) {
            if (!state.agents().containsKey(repoName)) {
                results.add(CheckResult.warn("State consistency", "Repo \"" + repoName + "\" in config but no agent created yet"));
            }
        }
        if (results.isEmpty() && !state.agents().isEmpty()) {
            results.add(CheckResult.pass("State consistency", "State matches config"));
        }
        return results;
    }

    private CheckResult checkGit() {
        return changeDetector.version()
            .map(version -> CheckResult.pass("Git", version))
            .orElseGet(() -> CheckResult.fail("Git", "git not found on PATH"));
    }

    private Optional<RepoExpertConfig> loadConfig() {
        try {
            return Optional.of(configService.load(configPath));
        } catch (IOException | RuntimeException e) {
            LOG.debug("Config {} could not be loaded", configPath, e);
            return Optional.empty();
        }
    }

    private Optional<AppState> loadState() {
        try {
            return Optional.of(stateStore.load());
        } catch (IOException | RuntimeException e) {
            LOG.debug("State could not be loaded", e);
            return Optional.empty();
        }
    }
}
