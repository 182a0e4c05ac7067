package io.repoexpert.core.admin;

public record CoreMemoryBlock(String label, String value, int limit) {
}
