package io.repoexpert.cli;

import io.repoexpert.core.cache.AnswerCache;
import io.repoexpert.core.config.ConfigService;
import io.repoexpert.core.git.ChangeDetector;
import io.repoexpert.core.observability.ObservabilityService;
import io.repoexpert.core.provider.AgentProvider;
import io.repoexpert.core.state.FileStateStore;
import io.repoexpert.core.state.StateStore;
import java.nio.file.Path;
import java.time.Clock;

public record CliContext(
    ConfigService configService,
    Path configPath,
    Path statePath,
    AgentProvider provider,
    ChangeDetector changeDetector,
    AnswerCache answerCache,
    ObservabilityService observabilityService,
    Clock clock
) {
    /**
     * @param root parent command carrying a {@code --state} override, or {@code null}
     */
    public StateStore stateStore(RepoExpertCliCommand root) {
        Path override = root == null ? null : root.statePath();
        return new FileStateStore(override != null ? override : statePath);
    }
}
