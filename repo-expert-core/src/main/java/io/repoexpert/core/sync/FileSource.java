package io.repoexpert.core.sync;

import io.repoexpert.core.collect.FileInfo;
import java.io.IOException;
import java.util.Optional;

/**
 * Supplies current file content during a sync; empty means the file is gone.
 */
@FunctionalInterface
public interface FileSource {
    Optional<FileInfo> read(String path) throws IOException;
}
