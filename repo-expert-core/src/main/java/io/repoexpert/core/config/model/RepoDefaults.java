package io.repoexpert.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RepoDefaults(
    @JsonAlias({"max_file_size_kb"}) int maxFileSizeKb,
    @JsonAlias({"memory_block_limit"}) int memoryBlockLimit,
    @JsonAlias({"bootstrap_on_create"}) boolean bootstrapOnCreate,
    @JsonAlias({"full_reindex_threshold"}) int fullReIndexThreshold,
    @JsonAlias({"sync_concurrency"}) int syncConcurrency,
    @JsonAlias({"max_chunk_size"}) int maxChunkSize
) {

    public static RepoDefaults defaults() {
        return new RepoDefaults(50, 5000, true, 500, 20, 2000);
    }
}
