package io.repoexpert.core.chunk;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits file content into chunks that each fit a character budget.
 *
 * <p>Content is cut at blank-line boundaries first. A section that does not fit on its own
 * is cut at line boundaries, and a single oversized line is hard-split. Bodies are taken
 * verbatim from the content, so joining the bodies of all chunks gives the content back.
 */
public final class Chunker {
    public static final int DEFAULT_MAX_CHUNK_SIZE = 2000;
    public static final String FILE_PREFIX = "FILE: ";
    public static final String CONTINUATION_SUFFIX = " (continued)";
    static final String SEPARATOR = "\n\n";

    private static final Pattern SECTION_BREAK = Pattern.compile("\n\n+");

    private final int maxChunkSize;

    public Chunker() {
        this(DEFAULT_MAX_CHUNK_SIZE);
    }

    public Chunker(int maxChunkSize) {
        if (maxChunkSize <= 0) {
            throw new IllegalArgumentException("maxChunkSize must be positive");
        }
        this.maxChunkSize = maxChunkSize;
    }

    public int maxChunkSize() {
        return maxChunkSize;
    }

    public List<Chunk> chunk(String path, String content) {
        Objects.requireNonNull(path, "path must not be null");
        if (content == null || content.isBlank()) {
            return List.of();
        }

        String header = FILE_PREFIX + path;
        if (header.length() + SEPARATOR.length() + content.length() <= maxChunkSize) {
            return List.of(new Chunk(header + SEPARATOR + content, path));
        }

        String continuationHeader = header + CONTINUATION_SUFFIX;
        // the continuation header is the longer one, so it bounds every body
        int bodyBudget = Math.max(1, maxChunkSize - continuationHeader.length() - SEPARATOR.length());

        List<String> bodies = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (String piece : pieces(content, bodyBudget)) {
            if (current.length() > 0 && current.length() + piece.length() > bodyBudget) {
                bodies.add(current.toString());
                current.setLength(0);
            }
            current.append(piece);
        }
        if (current.length() > 0) {
            bodies.add(current.toString());
        }

        List<Chunk> chunks = new ArrayList<>(bodies.size());
        for (int i = 0; i < bodies.size(); i++) {
            String body = bodies.get(i);
            if (body.isEmpty()) {
                continue;
            }
            String chunkHeader = chunks.isEmpty() ? header : continuationHeader;
            chunks.add(new Chunk(chunkHeader + SEPARATOR + body, path));
        }
        return chunks;
    }

    /**
     * Cuts content into ordered pieces no longer than {@code budget}. Each section keeps its
     * trailing blank-line run so the pieces concatenate back to the original text.
     */
    private List<String> pieces(String content, int budget) {
        List<String> out = new ArrayList<>();
        Matcher matcher = SECTION_BREAK.matcher(content);
        int start = 0;
        while (matcher.find()) {
            addSection(out, content.substring(start, matcher.end()), budget);
            start = matcher.end();
        }
        if (start < content.length()) {
            addSection(out, content.substring(start), budget);
        }
        return out;
    }

    private void addSection(List<String> out, String section, int budget) {
        if (section.length() <= budget) {
            out.add(section);
            return;
        }
        int start = 0;
        while (start < section.length()) {
            int newline = section.indexOf('\n', start);
            int end = newline < 0 ? section.length() : newline + 1;
            String line = section.substring(start, end);
            int offset = 0;
            while (offset < line.length()) {
                int cut = Math.min(line.length(), offset + budget);
                // keep surrogate pairs together unless the budget is a single char
                if (cut < line.length() && cut - 1 > offset && Character.isHighSurrogate(line.charAt(cut - 1))) {
                    cut--;
                }
                out.add(line.substring(offset, cut));
                offset = cut;
            }
            start = end;
        }
    }
}
