package io.repoexpert.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/**
 * One indexed repository. A {@code maxFileSizeKb} or {@code memoryBlockLimit} of zero means
 * "use the defaults".
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RepoConfig(
    String path,
    @JsonAlias({"base_path"}) String basePath,
    String description,
    List<String> extensions,
    @JsonAlias({"ignore_dirs"}) List<String> ignoreDirs,
    List<String> tags,
    String persona,
    @JsonAlias({"max_file_size_kb"}) int maxFileSizeKb,
    @JsonAlias({"memory_block_limit"}) int memoryBlockLimit
) {
    public RepoConfig {
        description = description == null ? "" : description;
        extensions = extensions == null ? List.of() : List.copyOf(extensions);
        ignoreDirs = ignoreDirs == null ? List.of("node_modules", ".git", "dist", "build", "target") : List.copyOf(ignoreDirs);
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public int effectiveMaxFileSizeKb(RepoDefaults defaults) {
        return maxFileSizeKb > 0 ? maxFileSizeKb : defaults.maxFileSizeKb();
    }

    public int effectiveMemoryBlockLimit(RepoDefaults defaults) {
        return memoryBlockLimit > 0 ? memoryBlockLimit : defaults.memoryBlockLimit();
    }
}
