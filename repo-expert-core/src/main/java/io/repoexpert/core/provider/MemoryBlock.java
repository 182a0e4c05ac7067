package io.repoexpert.core.provider;

public record MemoryBlock(String value, int limit) {
    public MemoryBlock {
        value = value == null ? "" : value;
        limit = Math.max(0, limit);
    }
}
