package io.repoexpert.cli;

import io.repoexpert.core.chunk.Chunker;
import io.repoexpert.core.collect.FileCollector;
import io.repoexpert.core.config.model.RepoExpertConfig;
import io.repoexpert.core.state.StateStore;
import io.repoexpert.core.sync.SyncService;
import io.repoexpert.core.watch.WatchService;
import java.io.IOException;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

@Command(name = "watch", description = "Poll repos and sync whenever HEAD moves")
public final class WatchCommand implements Callable<Integer> {
    private static final Logger LOG = LoggerFactory.getLogger(WatchCommand.class);

    private final CliContext context;

    @ParentCommand
    RepoExpertCliCommand root;

    @Option(names = "--repo", description = "Watch a single repo")
    String repo;

    @Option(names = "--interval", defaultValue = "30", description = "Seconds between polls (default: 30)")
    long intervalSeconds;

    @Option(names = "--once", description = "Run a single poll and exit")
    boolean once;

    public WatchCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            RepoExpertConfig config = context.configService().load(context.configPath());
            StateStore stateStore = context.stateStore(root);
            List<String> repoNames = CommandSupport.selectRepos(repo, config.repos().keySet());
            if (repo != null) {
                CommandSupport.requireRepo(config, repo);
            }
            WatchService watchService = new WatchService(
                config.repos(),
                stateStore,
                context.changeDetector(),
                new FileCollector(config.defaults()),
                new SyncService(
                    context.provider(),
                    new Chunker(config.defaults().maxChunkSize()),
                    config.defaults().syncConcurrency(),
                    config.defaults().fullReIndexThreshold(),
                    context.clock(),
                    context.observabilityService()
                ),
                context.clock()
            );

            poll(watchService, repoNames);
            if (once) {
                return 0;
            }

            long interval = Math.max(1, intervalSeconds);
            System.out.println("Watching " + String.join(", ", repoNames) + " every " + interval + "s. Press Ctrl+C to stop.");
            CountDownLatch shutdown = new CountDownLatch(1);
            ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
            try {
                Runtime.getRuntime().addShutdownHook(new Thread(shutdown::countDown));
                scheduler.scheduleWithFixedDelay(() -> pollQuietly(watchService, repoNames), interval, interval, TimeUnit.SECONDS);
                shutdown.await();
            } finally {
                scheduler.shutdown();
                scheduler.awaitTermination(30, TimeUnit.SECONDS);
            }
            return 0;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            System.err.println("Watch command interrupted");
            return 1;
        } catch (Exception e) {
            System.err.println("Watch command failed: " + e.getMessage());
            return 1;
        }
    }

    private void poll(WatchService watchService, List<String> repoNames) throws IOException {
        for (String line : watchService.tick(repoNames)) {
            System.out.println(line);
        }
    }

    private void pollQuietly(WatchService watchService, List<String> repoNames) {
        try {
            poll(watchService, repoNames);
        } catch (IOException | RuntimeException e) {
            // a failed poll must not cancel the schedule
            LOG.warn("Watch poll failed", e);
            System.err.println("Watch poll failed: " + e.getMessage());
        }
    }
}
