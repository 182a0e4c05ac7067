package io.repoexpert.core.collect;

import java.util.List;
import java.util.Set;

/**
 * Decides which repository files are indexed.
 */
public final class FileFilter {
    private final List<String> extensions;
    private final Set<String> ignoreDirs;
    private final int maxFileSizeKb;

    public FileFilter(List<String> extensions, List<String> ignoreDirs, int maxFileSizeKb) {
        this.extensions = extensions == null ? List.of() : List.copyOf(extensions);
        this.ignoreDirs = ignoreDirs == null ? Set.of() : Set.copyOf(ignoreDirs);
        this.maxFileSizeKb = maxFileSizeKb;
    }

    public boolean shouldInclude(String relativePath, double sizeKb) {
        if (!hasAllowedExtension(relativePath)) {
            return false;
        }
        if (sizeKb > maxFileSizeKb) {
            return false;
        }
        for (String segment : relativePath.split("/")) {
            if (ignoreDirs.contains(segment)) {
                return false;
            }
        }
        return true;
    }

    private boolean hasAllowedExtension(String relativePath) {
        String fileName = relativePath.substring(relativePath.lastIndexOf('/') + 1);
        int dot = fileName.lastIndexOf('.');
        if (dot <= 0) {
            return false;
        }
        return extensions.contains(fileName.substring(dot));
    }
}
