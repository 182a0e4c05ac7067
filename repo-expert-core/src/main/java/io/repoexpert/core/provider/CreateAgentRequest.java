package io.repoexpert.core.provider;

import java.util.List;

public record CreateAgentRequest(
    String name,
    String repoName,
    String description,
    String persona,
    List<String> tags,
    String model,
    String embedding,
    int memoryBlockLimit
) {
    public CreateAgentRequest {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }
}
