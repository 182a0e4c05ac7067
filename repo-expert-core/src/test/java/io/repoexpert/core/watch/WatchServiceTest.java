package io.repoexpert.core.watch;

import static org.assertj.core.api.Assertions.assertThat;

import io.repoexpert.core.chunk.Chunker;
import io.repoexpert.core.collect.FileCollector;
import io.repoexpert.core.config.model.RepoConfig;
import io.repoexpert.core.config.model.RepoDefaults;
import io.repoexpert.core.git.ChangeDetector;
import io.repoexpert.core.passage.PassageMap;
import io.repoexpert.core.provider.InMemoryAgentProvider;
import io.repoexpert.core.state.AgentState;
import io.repoexpert.core.state.AppState;
import io.repoexpert.core.state.FileStateStore;
import io.repoexpert.core.sync.SyncService;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class WatchServiceTest {

    @TempDir
    Path tempDir;

    private final Clock clock = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);
    private final InMemoryAgentProvider provider = new InMemoryAgentProvider();
    private final FakeChangeDetector changeDetector = new FakeChangeDetector();
    private FileStateStore stateStore;
    private WatchService watchService;
    private Path repoDir;

    @BeforeEach
    void setUp() throws Exception {
        repoDir = Files.createDirectories(tempDir.resolve("web"));
        Files.writeString(repoDir.resolve("app.ts"), "export const app = 1;\n");
        RepoConfig repo = new RepoConfig(repoDir.toString(), null, "", List.of(".ts"), null, null, null, 0, 0);
        stateStore = new FileStateStore(tempDir.resolve("state.json"));
        watchService = new WatchService(
            Map.of("web", repo),
            stateStore,
            changeDetector,
            new FileCollector(RepoDefaults.defaults()),
            new SyncService(provider, new Chunker(), 4, 500, clock, null),
            clock
        );
    }

    @Test
    void shouldSyncOnlyWhenHeadMoved() {
        assertThat(WatchService.shouldSync(null, "abc")).isTrue();
        assertThat(WatchService.shouldSync("abc", "def")).isTrue();
        assertThat(WatchService.shouldSync("abc", "abc")).isFalse();
    }

    @Test
    void shouldFormatSyncLogLine() {
        assertThat(WatchService.formatSyncLog("web", "abcdef1234", "1234567890", 3, Duration.ofMillis(1530)))
            .isEqualTo("[web] synced abcdef1..1234567 (3 files, 1.5s)");
        assertThat(WatchService.formatSyncLog("web", null, "1234567890", 0, Duration.ZERO))
            .isEqualTo("[web] synced initial..1234567 (0 files, 0.0s)");
    }

    @Test
    void shouldIndexEverythingOnFirstTickThenOnlyChangedFiles() throws Exception {
        stateStore.save(AppState.empty().withAgent(AgentState.created("agent-1", "web", clock.instant())));
        changeDetector.head = "c1";

        assertThat(watchService.tick(List.of("web"))).containsExactly("[web] synced initial..c1 (1 files, 0.0s)");
        assertThat(watchService.tick(List.of("web"))).isEmpty();

        Files.writeString(repoDir.resolve("app.ts"), "export const app = 2;\n");
        changeDetector.head = "c2";
        changeDetector.changed = List.of("app.ts");

        assertThat(watchService.tick(List.of("web"))).containsExactly("[web] synced c1..c2 (1 files, 0.0s)");
        AgentState agent = stateStore.load().agent("web").orElseThrow();
        assertThat(agent.lastSyncCommit()).isEqualTo("c2");
        assertThat(provider.passageText("agent-1", agent.passages().passageIds("app.ts").get(0)))
            .isEqualTo("FILE: app.ts\n\nexport const app = 2;\n");
        assertThat(provider.passageCount("agent-1")).isEqualTo(1);
    }

    @Test
    void shouldMoveCommitWhenHeadChangedWithoutFileDiff() throws Exception {
        String id = provider.seedPassage("agent-1", "FILE: app.ts\n\nexport const app = 1;\n");
        AgentState agent = AgentState.created("agent-1", "web", clock.instant())
            .withSync(PassageMap.of(Map.of("app.ts", List.of(id))), "c1", clock.instant());
        stateStore.save(AppState.empty().withAgent(agent));
        changeDetector.head = "c2";

        assertThat(watchService.tick(List.of("web"))).containsExactly("[web] synced c1..c2 (0 files, 0.0s)");
        AgentState saved = stateStore.load().agent("web").orElseThrow();
        assertThat(saved.lastSyncCommit()).isEqualTo("c2");
        assertThat(saved.passages().passageIds("app.ts")).containsExactly(id);
    }

    @Test
    void shouldReportFailedSyncAndRetryOnNextTick() throws Exception {
        stateStore.save(AppState.empty().withAgent(AgentState.created("agent-1", "web", clock.instant())));
        changeDetector.head = "c1";
        provider.failStoreContaining("export const app");

        List<String> failed = watchService.tick(List.of("web"));
        assertThat(failed).hasSize(1);
        assertThat(failed.get(0)).startsWith("[web] sync error:");
        assertThat(stateStore.load().agent("web").orElseThrow().lastSyncCommit()).isNull();

        provider.failStoreContaining(null);
        assertThat(watchService.tick(List.of("web"))).containsExactly("[web] synced initial..c1 (1 files, 0.0s)");
    }

    @Test
    void shouldSkipReposWithoutAgentOrConfig() throws Exception {
        changeDetector.head = "c1";

        assertThat(watchService.tick(List.of("web", "unknown"))).isEmpty();
    }

    private static final class FakeChangeDetector implements ChangeDetector {
        String head;
        List<String> changed = new ArrayList<>();

        @Override
        public Optional<String> headCommit(Path repoPath) {
            return Optional.ofNullable(head);
        }

        @Override
        public List<String> changedFiles(Path repoPath, String sinceRef) {
            return changed;
        }

        @Override
        public Optional<String> version() {
            return Optional.of("git version 2.45.0");
        }
    }
}
