package io.repoexpert.core.chunk;

import java.util.Objects;

/**
 * A bounded unit of file content ready to be stored as a passage.
 * The first line of {@code text} is always the file header.
 */
public record Chunk(String text, String sourcePath) {
    public Chunk {
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(sourcePath, "sourcePath must not be null");
    }

    public boolean continuation() {
        return header().endsWith(Chunker.CONTINUATION_SUFFIX);
    }

    public String header() {
        int newline = text.indexOf('\n');
        return newline < 0 ? text : text.substring(0, newline);
    }

    /**
     * Content that follows the header and its blank separator line.
     */
    public String body() {
        String header = header();
        if (text.length() <= header.length() + Chunker.SEPARATOR.length()) {
            return "";
        }
        return text.substring(header.length() + Chunker.SEPARATOR.length());
    }
}
