package me.wargame.mcp.domain.chunking;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.wargame.mcp.domain.model.exception.ConfigurationException;
import me.wargame.mcp.infrastructure.config.WargameProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.NavigableSet;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Splits document text into overlapping, token-bounded chunks.
 *
 * <p>
 * The window holds at most {@code maxTokens} tokens and the next window starts
 * {@code overlapTokens} before the previous cut, so consecutive chunks share
 * exactly {@code overlapTokens} tokens. A cut that would land inside a
 * structural unit (paragraph, list item, table row, fenced code block) is
 * moved back to the start of that unit, provided the window still advances
 * past the overlap. Only a unit longer than the whole window is cut hard.
 *
 * <p>
 * Output depends only on the input text and the parameters.
 */
@Component
@Slf4j
public class ChunkSegmenter {

    private static final Pattern LIST_ITEM = Pattern.compile("^\\s*(?:[-*+]|\\d+[.)])\\s+.*");
    private static final Pattern TABLE_ROW = Pattern.compile("^\\s*\\|.*");
    private static final Pattern FENCE = Pattern.compile("^\\s*(?:```|~~~).*");

    private final Tokenizer tokenizer;
    private final int defaultMaxTokens;
    private final int defaultOverlapTokens;

    @Autowired
    public ChunkSegmenter(WargameProperties properties) {
        this(resolveTokenizer(properties.getChunking().getTokenizer(), properties.getEmbedding().getModel()),
                properties.getChunking().getMaxTokens(),
                properties.getChunking().getOverlapTokens());
    }

    public ChunkSegmenter(Tokenizer tokenizer, int defaultMaxTokens, int defaultOverlapTokens) {
        this.tokenizer = tokenizer;
        this.defaultMaxTokens = defaultMaxTokens;
        this.defaultOverlapTokens = defaultOverlapTokens;
    }

    public Tokenizer getTokenizer() {
        return tokenizer;
    }

    public List<String> segment(String text, int maxTokens, int overlapTokens) {
        return split(text, maxTokens, overlapTokens).stream().map(TextSegment::text).toList();
    }

    public List<TextSegment> split(String text) {
        return split(text, defaultMaxTokens, defaultOverlapTokens);
    }

    public List<TextSegment> split(String text, int maxTokens, int overlapTokens) {
        if (maxTokens <= 0) {
            throw new IllegalArgumentException("maxTokens must be > 0, got " + maxTokens);
        }
        if (overlapTokens < 0 || overlapTokens >= maxTokens) {
            throw new IllegalArgumentException(
                    "overlapTokens must be >= 0 and < maxTokens, got " + overlapTokens + " / " + maxTokens);
        }
        List<TextSegment> segments = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return segments;
        }

        String normalized = text.replace("\r\n", "\n");
        List<TokenSpan> tokens = tokenizer.tokenize(normalized);
        int total = tokens.size();
        if (total == 0) {
            return segments;
        }
        NavigableSet<Integer> boundaries = boundaryTokens(normalized, tokens);

        int start = 0;
        while (true) {
            int end = Math.min(start + maxTokens, total);
            if (end < total && !boundaries.contains(end)) {
                Integer boundary = boundaries.lower(end);
                if (boundary != null && boundary > start + overlapTokens) {
                    end = boundary;
                }
            }
            String chunkText = normalized.substring(tokens.get(start).start(), tokens.get(end - 1).end());
            segments.add(new TextSegment(chunkText, start, end));
            if (end >= total) {
                break;
            }
            start = end - overlapTokens;
        }

        log.debug("[Chunking] {} tokens -> {} chunks (max={}, overlap={})", total, segments.size(), maxTokens,
                overlapTokens);
        return segments;
    }

    /**
     * Token indices before which a cut keeps every structural unit whole.
     */
    private NavigableSet<Integer> boundaryTokens(String text, List<TokenSpan> tokens) {
        List<Integer> offsets = new ArrayList<>();
        boolean inFence = false;
        boolean previousBlank = false;
        boolean closedFence = false;
        int lineStart = 0;
        while (lineStart < text.length()) {
            int newline = text.indexOf('\n', lineStart);
            int lineEnd = newline < 0 ? text.length() : newline;
            String line = text.substring(lineStart, lineEnd);
            boolean blank = line.isBlank();

            if (FENCE.matcher(line).matches()) {
                if (!inFence) {
                    offsets.add(lineStart);
                    inFence = true;
                } else {
                    inFence = false;
                    closedFence = true;
                    previousBlank = false;
                    lineStart = lineEnd + 1;
                    continue;
                }
            } else if (!inFence && !blank) {
                if (previousBlank || closedFence || LIST_ITEM.matcher(line).matches()
                        || TABLE_ROW.matcher(line).matches()) {
                    offsets.add(lineStart);
                }
                closedFence = false;
            }
            if (!inFence) {
                previousBlank = blank;
            }
            lineStart = lineEnd + 1;
        }

        NavigableSet<Integer> boundaries = new TreeSet<>();
        int tokenIndex = 0;
        for (int offset : offsets) {
            while (tokenIndex < tokens.size() && tokens.get(tokenIndex).start() < offset) {
                tokenIndex++;
            }
            if (tokenIndex > 0 && tokenIndex < tokens.size()) {
                boundaries.add(tokenIndex);
            }
        }
        return boundaries;
    }

    /**
     * {@code model} counts tokens the way the embedding model does; {@code word}
     * and {@code whitespace} are offline approximations.
     */
    static Tokenizer resolveTokenizer(String name, String embeddingModel) {
        String normalized = name == null ? "model" : name.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
        case "model", "" -> new ModelTokenizer(embeddingModel);
        case "word" -> RegexTokenizer.words();
        case "whitespace" -> RegexTokenizer.whitespace();
        default -> throw new ConfigurationException("Unknown tokenizer: " + name);
        };
    }
}
