package io.repoexpert.core.git;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

public interface ChangeDetector {
    /**
     * @return the current revision, or empty when {@code repoPath} is not under version control
     */
    Optional<String> headCommit(Path repoPath) throws IOException;

    /**
     * Repository-relative paths changed between {@code sinceRef} and the current revision.
     */
    List<String> changedFiles(Path repoPath, String sinceRef) throws IOException;

    /**
     * @return the version control tool's version line, or empty when it is not installed
     */
    Optional<String> version();
}
