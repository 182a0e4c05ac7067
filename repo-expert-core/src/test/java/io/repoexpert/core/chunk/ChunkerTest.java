package io.repoexpert.core.chunk;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;

class ChunkerTest {

    @Test
    void shouldReturnNothingForBlankContent() {
        Chunker chunker = new Chunker();

        assertThat(chunker.chunk("src/a.ts", "")).isEmpty();
        assertThat(chunker.chunk("src/a.ts", "  \n\t\n  ")).isEmpty();
        assertThat(chunker.chunk("src/a.ts", null)).isEmpty();
    }

    @Test
    void shouldKeepSmallFileInSingleChunk() {
        Chunker chunker = new Chunker();

        List<Chunk> chunks = chunker.chunk("src/a.ts", "export const a = 1;\n");

        assertThat(chunks).hasSize(1);
        assertThat(chunks.get(0).text()).isEqualTo("FILE: src/a.ts\n\nexport const a = 1;\n");
        assertThat(chunks.get(0).sourcePath()).isEqualTo("src/a.ts");
        assertThat(chunks.get(0).continuation()).isFalse();
    }

    @Test
    void shouldSplitAtBlankLinesAndMarkContinuations() {
        Chunker chunker = new Chunker(120);
        String content = IntStream.range(0, 12)
            .mapToObj(i -> "function f" + i + "() { return " + i + "; }")
            .collect(Collectors.joining("\n\n"));

        List<Chunk> chunks = chunker.chunk("src/fns.ts", content);

        assertThat(chunks).hasSizeGreaterThan(1);
        assertThat(chunks).allSatisfy(chunk -> {
            assertThat(chunk.text().length()).isLessThanOrEqualTo(120);
            assertThat(chunk.body()).isNotEmpty();
            assertThat(chunk.sourcePath()).isEqualTo("src/fns.ts");
        });
        assertThat(chunks.get(0).header()).isEqualTo("FILE: src/fns.ts");
        assertThat(chunks.subList(1, chunks.size()))
            .allSatisfy(chunk -> assertThat(chunk.header()).isEqualTo("FILE: src/fns.ts (continued)"));
        assertThat(chunks.stream().map(Chunk::body).collect(Collectors.joining())).isEqualTo(content);
    }

    @Test
    void shouldSplitOversizedSectionByLinesAndHardSplitLongLines() {
        Chunker chunker = new Chunker(80);
        String longLine = "x".repeat(300);
        String content = "line one\nline two\n" + longLine + "\nlast line";

        List<Chunk> chunks = chunker.chunk("a.txt", content);

        assertThat(chunks).allSatisfy(chunk -> assertThat(chunk.text().length()).isLessThanOrEqualTo(80));
        assertThat(chunks.stream().map(Chunk::body).collect(Collectors.joining())).isEqualTo(content);
    }

    @Test
    void shouldNotSplitSurrogatePairsWhenHardSplitting() {
        Chunker chunker = new Chunker(80);
        String content = "😀".repeat(200);

        List<Chunk> chunks = chunker.chunk("a.txt", content);

        assertThat(chunks).hasSizeGreaterThan(1);
        assertThat(chunks).allSatisfy(chunk -> {
            String body = chunk.body();
            assertThat(chunk.text().length()).isLessThanOrEqualTo(80);
            assertThat(Character.isHighSurrogate(body.charAt(body.length() - 1))).isFalse();
            assertThat(Character.isLowSurrogate(body.charAt(0))).isFalse();
        });
        assertThat(chunks.stream().map(Chunk::body).collect(Collectors.joining())).isEqualTo(content);
    }

    @Test
    void shouldStillMakeProgressWhenHeaderExceedsBudget() {
        Chunker chunker = new Chunker(10);
        String content = "abc\n\ndef\n\nghi".repeat(5);

        List<Chunk> chunks = chunker.chunk("a/very/long/path/name.ts", content);

        assertThat(chunks).isNotEmpty();
        assertThat(chunks).allSatisfy(chunk -> assertThat(chunk.body()).isNotEmpty());
        assertThat(chunks.stream().map(Chunk::body).collect(Collectors.joining())).isEqualTo(content);
    }

    @Test
    void shouldRejectNonPositiveBudget() {
        assertThatThrownBy(() -> new Chunker(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
