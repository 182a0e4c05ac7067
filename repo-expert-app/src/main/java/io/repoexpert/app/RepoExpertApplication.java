package io.repoexpert.app;

import io.repoexpert.cli.ActivityCommand;
import io.repoexpert.cli.AskCommand;
import io.repoexpert.cli.CliContext;
import io.repoexpert.cli.DestroyCommand;
import io.repoexpert.cli.DoctorCommand;
import io.repoexpert.cli.ExportCommand;
import io.repoexpert.cli.ListCommand;
import io.repoexpert.cli.ReconcileCommand;
import io.repoexpert.cli.RepoExpertCliCommand;
import io.repoexpert.cli.SearchCommand;
import io.repoexpert.cli.SetupCommand;
import io.repoexpert.cli.StatusCommand;
import io.repoexpert.cli.SyncCommand;
import io.repoexpert.cli.WatchCommand;
import io.repoexpert.core.cache.InMemoryAnswerCache;
import io.repoexpert.core.config.ConfigPaths;
import io.repoexpert.core.config.ConfigService;
import io.repoexpert.core.config.model.AskConfig;
import io.repoexpert.core.config.model.RepoExpertConfig;
import io.repoexpert.core.git.GitChangeDetector;
import io.repoexpert.core.observability.FileAuditStore;
import io.repoexpert.core.observability.ObservabilityService;
import io.repoexpert.core.provider.LettaProvider;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

public final class RepoExpertApplication {
    private static final Logger LOG = LoggerFactory.getLogger(RepoExpertApplication.class);

    private RepoExpertApplication() {
    }

    public static void main(String[] args) {
        ConfigService configService = new ConfigService();
        Path configPath = ConfigPaths.defaultConfigPath();
        RepoExpertConfig config = loadConfig(configService, configPath);
        Clock clock = Clock.systemUTC();

        AskConfig ask = config.ask();
        CliContext context = new CliContext(
            configService,
            configPath,
            ConfigPaths.defaultStatePath(),
            new LettaProvider(config.letta().baseUrl(), config.letta().apiKey()),
            new GitChangeDetector(),
            new InMemoryAnswerCache(Duration.ofSeconds(Math.max(0, ask.cacheTtlSeconds())), clock, ask.cacheMaxEntries()),
            new ObservabilityService(new FileAuditStore(ConfigPaths.defaultAuditPath()), clock),
            clock
        );

        CommandLine commandLine = new CommandLine(new RepoExpertCliCommand());
        commandLine.addSubcommand("setup", new SetupCommand(context));
        commandLine.addSubcommand("sync", new SyncCommand(context));
        commandLine.addSubcommand("reconcile", new ReconcileCommand(context));
        commandLine.addSubcommand("ask", new AskCommand(context));
        commandLine.addSubcommand("status", new StatusCommand(context));
        commandLine.addSubcommand("list", new ListCommand(context));
        commandLine.addSubcommand("destroy", new DestroyCommand(context));
        commandLine.addSubcommand("activity", new ActivityCommand(context));
        commandLine.addSubcommand("search", new SearchCommand(context));
        commandLine.addSubcommand("watch", new WatchCommand(context));
        commandLine.addSubcommand("export", new ExportCommand(context));
        commandLine.addSubcommand("doctor", new DoctorCommand(context));

        int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    private static RepoExpertConfig loadConfig(ConfigService configService, Path configPath) {
        try {
            return configService.load(configPath);
        } catch (Exception e) {
            LOG.warn("Falling back to default config, {} could not be read: {}", configPath, e.getMessage());
            return RepoExpertConfig.defaultConfig();
        }
    }
}
