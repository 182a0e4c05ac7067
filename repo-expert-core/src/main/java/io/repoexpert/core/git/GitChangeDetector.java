package io.repoexpert.core.git;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ChangeDetector} that runs the {@code git} executable found on the PATH.
 */
public final class GitChangeDetector implements ChangeDetector {
    private static final Logger LOG = LoggerFactory.getLogger(GitChangeDetector.class);

    private final String executable;
    private final Duration timeout;

    public GitChangeDetector() {
        this(Duration.ofSeconds(10));
    }

    public GitChangeDetector(Duration timeout) {
        this("git", timeout);
    }

    GitChangeDetector(String executable, Duration timeout) {
        this.executable = executable;
        this.timeout = timeout;
    }

    @Override
    public Optional<String> headCommit(Path repoPath) throws IOException {
        GitOutput output = run(repoPath, "rev-parse", "HEAD");
        if (output.exitCode() != 0 || output.stdout().isBlank()) {
            return Optional.empty();
        }
        return Optional.of(output.stdout().trim());
    }

    @Override
    public List<String> changedFiles(Path repoPath, String sinceRef) throws IOException {
        if (sinceRef == null || sinceRef.isBlank() || sinceRef.startsWith("-")) {
            throw new IllegalArgumentException("Invalid git ref: " + sinceRef);
        }
        // unquoted, NUL separated names so non-ASCII paths match the files on disk
        GitOutput output = run(repoPath, "-c", "core.quotePath=false", "diff", "--name-only", "-z", sinceRef + "..HEAD");
        if (output.exitCode() != 0) {
            throw new IOException("git diff failed in " + repoPath + ": " + output.stdout().trim());
        }
        List<String> files = new ArrayList<>();
        for (String name : output.stdout().split("\0")) {
            if (!name.isEmpty()) {
                files.add(name);
            }
        }
        return files;
    }

    @Override
    public Optional<String> version() {
        try {
            GitOutput output = run(Path.of("."), "--version");
            if (output.exitCode() != 0 || output.stdout().isBlank()) {
                return Optional.empty();
            }
            return Optional.of(output.stdout().trim());
        } catch (IOException e) {
            LOG.debug("{} --version failed: {}", executable, e.getMessage());
            return Optional.empty();
        }
    }

    private GitOutput run(Path repoPath, String... args) throws IOException {
        List<String> command = new ArrayList<>();
        command.add(executable);
        command.addAll(List.of(args));
        // output goes to a file so a hung git cannot block us past the timeout
        Path outputFile = Files.createTempFile("repo-expert-git", ".out");
        try {
            Process process = new ProcessBuilder(command)
                .directory(repoPath.toFile())
                .redirectErrorStream(true)
                .redirectOutput(outputFile.toFile())
                .start();
            try {
                boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
                if (!finished) {
                    process.destroyForcibly();
                    throw new IOException("git " + String.join(" ", args) + " timed out in " + repoPath);
                }
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                process.destroyForcibly();
                throw new IOException("git " + String.join(" ", args) + " interrupted", ie);
            }
            return new GitOutput(process.exitValue(), Files.readString(outputFile, StandardCharsets.UTF_8));
        } finally {
            Files.deleteIfExists(outputFile);
        }
    }

    private record GitOutput(int exitCode, String stdout) {
    }
}
