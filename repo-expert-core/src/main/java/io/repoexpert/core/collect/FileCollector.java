package io.repoexpert.core.collect;

import io.repoexpert.core.config.ConfigPaths;
import io.repoexpert.core.config.model.RepoConfig;
import io.repoexpert.core.config.model.RepoDefaults;
import java.io.IOException;
import java.nio.charset.MalformedInputException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads indexable files of a repository from disk.
 */
public final class FileCollector {
    private static final Logger LOG = LoggerFactory.getLogger(FileCollector.class);

    private final RepoDefaults defaults;

    public FileCollector(RepoDefaults defaults) {
        this.defaults = defaults;
    }

    public List<FileInfo> collectAll(RepoConfig repo) throws IOException {
        Path root = root(repo);
        FileFilter filter = filter(repo);
        List<FileInfo> files = new ArrayList<>();
        try (Stream<Path> walk = Files.walk(root)) {
            List<Path> candidates = walk
                .filter(Files::isRegularFile)
                .sorted(Comparator.naturalOrder())
                .toList();
            for (Path file : candidates) {
                String relative = relativize(root, file);
                double sizeKb = Files.size(file) / 1024.0;
                if (!filter.shouldInclude(relative, sizeKb)) {
                    continue;
                }
                read(file).ifPresent(content -> files.add(new FileInfo(relative, content, sizeKb)));
            }
        }
        return files;
    }

    /**
     * @return empty when the file was deleted or is excluded by the repository filter
     */
    public Optional<FileInfo> collect(RepoConfig repo, String relativePath) throws IOException {
        Path file = root(repo).resolve(relativePath).normalize();
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        double sizeKb = Files.size(file) / 1024.0;
        if (!filter(repo).shouldInclude(relativePath.replace('\\', '/'), sizeKb)) {
            return Optional.empty();
        }
        return read(file).map(content -> new FileInfo(relativePath, content, sizeKb));
    }

    /**
     * Maps paths relative to the repository root onto paths relative to the indexed base
     * directory, dropping those outside it.
     */
    public List<String> scopeToBase(RepoConfig repo, List<String> repoRelativePaths) {
        String basePath = repo.basePath() == null ? "" : repo.basePath().replace('\\', '/');
        while (basePath.endsWith("/")) {
            basePath = basePath.substring(0, basePath.length() - 1);
        }
        if (basePath.isEmpty() || basePath.equals(".")) {
            return List.copyOf(repoRelativePaths);
        }
        String prefix = basePath + "/";
        List<String> scoped = new ArrayList<>();
        for (String path : repoRelativePaths) {
            if (path.startsWith(prefix)) {
                scoped.add(path.substring(prefix.length()));
            }
        }
        return scoped;
    }

    private Optional<String> read(Path file) throws IOException {
        try {
            return Optional.of(Files.readString(file));
        } catch (MalformedInputException e) {
            LOG.debug("Skipping non UTF-8 file {}", file);
            return Optional.empty();
        }
    }

    private FileFilter filter(RepoConfig repo) {
        return new FileFilter(repo.extensions(), repo.ignoreDirs(), repo.effectiveMaxFileSizeKb(defaults));
    }

    private Path root(RepoConfig repo) {
        Path base = ConfigPaths.resolve(repo.path());
        if (repo.basePath() == null || repo.basePath().isBlank()) {
            return base;
        }
        return base.resolve(repo.basePath());
    }

    private String relativize(Path root, Path file) {
        return root.relativize(file).toString().replace('\\', '/');
    }
}
