package io.repoexpert.core.provider;

public record AgentSummary(String id, String name, String description, String model) {
    public AgentSummary {
        name = name == null ? "" : name;
        description = description == null ? "" : description;
        model = model == null ? "" : model;
    }
}
