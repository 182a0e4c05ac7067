package io.repoexpert.core.collect;

/**
 * @param path repository-relative path using forward slashes
 */
public record FileInfo(String path, String content, double sizeKb) {
}
