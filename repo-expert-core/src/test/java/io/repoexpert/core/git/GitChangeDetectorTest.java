package io.repoexpert.core.git;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class GitChangeDetectorTest {

    @TempDir
    Path tempDir;

    private final GitChangeDetector detector = new GitChangeDetector();

    @Test
    void shouldRejectOptionLikeRefs() {
        assertThatThrownBy(() -> detector.changedFiles(tempDir, "--output=/tmp/x"))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> detector.changedFiles(tempDir, " "))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldReportHeadAndChangedFilesWithUnquotedNames() throws Exception {
        assumeTrue(gitAvailable(), "git is not installed");
        git("init", "-q");
        Files.writeString(tempDir.resolve("app.ts"), "export const a = 1;\n");
        git("add", ".");
        git("commit", "-q", "-m", "first");
        String first = detector.headCommit(tempDir).orElseThrow();

        Files.writeString(tempDir.resolve("café.ts"), "export const b = 2;\n");
        Files.writeString(tempDir.resolve("with space.ts"), "export const c = 3;\n");
        git("add", ".");
        git("commit", "-q", "-m", "second");

        assertThat(detector.headCommit(tempDir)).isPresent().get().isNotEqualTo(first);
        assertThat(detector.changedFiles(tempDir, first)).containsExactlyInAnyOrder("café.ts", "with space.ts");
        assertThat(Files.exists(tempDir.resolve(detector.changedFiles(tempDir, first).get(0)))).isTrue();
    }

    @Test
    void shouldFailForUnknownRef() throws Exception {
        assumeTrue(gitAvailable(), "git is not installed");
        git("init", "-q");
        Files.writeString(tempDir.resolve("app.ts"), "export const a = 1;\n");
        git("add", ".");
        git("commit", "-q", "-m", "first");

        assertThatThrownBy(() -> detector.changedFiles(tempDir, "no-such-ref"))
            .isInstanceOf(IOException.class)
            .hasMessageContaining("git diff failed");
    }

    @Test
    void shouldTimeOutWhenGitHangsWithOpenOutput() throws Exception {
        assumeTrue(Files.exists(Path.of("/bin/sh")), "needs a POSIX shell");
        Path script = tempDir.resolve("hanging-git");
        Files.writeString(script, "#!/bin/sh\necho started\nsleep 30\n");
        assumeTrue(script.toFile().setExecutable(true));
        GitChangeDetector hanging = new GitChangeDetector(script.toString(), Duration.ofMillis(300));

        long started = System.nanoTime();
        assertThatThrownBy(() -> hanging.headCommit(tempDir))
            .isInstanceOf(IOException.class)
            .hasMessageContaining("timed out");
        assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(10));
    }

    @Test
    void shouldReportVersionOrEmptyWhenMissing() {
        assertThat(new GitChangeDetector("repo-expert-no-such-git", Duration.ofSeconds(5)).version()).isEmpty();

        assumeTrue(gitAvailable(), "git is not installed");
        assertThat(detector.version()).hasValueSatisfying(version -> assertThat(version).startsWith("git version"));
    }

    private void git(String... args) throws Exception {
        List<String> command = new ArrayList<>(List.of(
            "git", "-c", "user.name=Test", "-c", "user.email=test@example.com", "-c", "commit.gpgsign=false"
        ));
        command.addAll(List.of(args));
        Process process = new ProcessBuilder(command)
            .directory(tempDir.toFile())
            .redirectErrorStream(true)
            .start();
        String output = new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
        assertThat(process.waitFor(10, TimeUnit.SECONDS)).isTrue();
        assertThat(process.exitValue()).as(output).isZero();
    }

    private static boolean gitAvailable() {
        try {
            Process process = new ProcessBuilder("git", "--version").redirectErrorStream(true).start();
            process.getInputStream().readAllBytes();
            return process.waitFor(10, TimeUnit.SECONDS) && process.exitValue() == 0;
        } catch (IOException e) {
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
