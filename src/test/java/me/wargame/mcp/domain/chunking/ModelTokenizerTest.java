package me.wargame.mcp.domain.chunking;

import me.wargame.mcp.infrastructure.config.WargameProperties;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ModelTokenizerTest {

    private final ModelTokenizer tokenizer = new ModelTokenizer("text-embedding-3-large");

    @Test
    void shouldUseCl100kForOpenAiEmbeddingModels() {
        assertEquals("cl100k_base", tokenizer.getEncodingName());
        assertEquals("model", tokenizer.getName());
    }

    @Test
    void shouldFallBackToCl100kForUnknownModel() {
        ModelTokenizer unknown = new ModelTokenizer("local-embedder");

        assertEquals("cl100k_base", unknown.getEncodingName());
    }

    @Test
    void shouldCountBpeTokensRatherThanWords() {
        assertEquals(2, tokenizer.count("hello world"));
        assertEquals(0, tokenizer.count(""));
        assertEquals(0, tokenizer.count(null));
    }

    @Test
    void shouldAgreeBetweenCountAndSpans() {
        String text = "The AAR's findings: 3rd Battalion's echelon broke at 0400.";

        assertEquals(tokenizer.count(text), tokenizer.tokenize(text).size());
    }

    @Test
    void shouldProduceContiguousSpansCoveringText() {
        String text = "Übung Nord → 演習 🎯 done.\nNext paragraph";

        List<TokenSpan> spans = tokenizer.tokenize(text);

        assertEquals(0, spans.get(0).start());
        assertEquals(text.length(), spans.get(spans.size() - 1).end());
        StringBuilder rebuilt = new StringBuilder();
        int previousEnd = 0;
        for (TokenSpan span : spans) {
            assertEquals(previousEnd, span.start());
            assertTrue(span.end() >= span.start());
            rebuilt.append(text, span.start(), span.end());
            previousEnd = span.end();
        }
        assertEquals(text, rebuilt.toString());
    }

    @Test
    void shouldMapBytesInsideCharactersToCharacterEnd() {
        assertArrayEquals(new int[] { 0, 1, 2, 2 }, ModelTokenizer.charOffsetsByByte("aé"));
        assertArrayEquals(new int[] { 0, 2, 2, 2, 2 }, ModelTokenizer.charOffsetsByByte("🎯"));
    }

    @Test
    void shouldBeDefaultTokenizerOfSegmenter() {
        ChunkSegmenter segmenter = new ChunkSegmenter(new WargameProperties());

        assertInstanceOf(ModelTokenizer.class, segmenter.getTokenizer());
    }

    @Test
    void shouldSizeWindowsInModelTokens() {
        String text = IntStream.range(0, 600).mapToObj(i -> "unit" + i).collect(Collectors.joining(" "));
        ChunkSegmenter segmenter = new ChunkSegmenter(tokenizer, 100, 20);

        List<TextSegment> segments = segmenter.split(text);

        int total = tokenizer.count(text);
        assertEquals(total, segments.get(segments.size() - 1).endToken());
        for (int i = 0; i < segments.size(); i++) {
            assertTrue(segments.get(i).tokenCount() <= 100);
            if (i > 0) {
                assertEquals(20, segments.get(i - 1).endToken() - segments.get(i).startToken());
            }
        }
    }
}
