package me.wargame.mcp.adapter.outbound.embedding;

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

import me.wargame.mcp.domain.service.HashSupport;
import me.wargame.mcp.port.outbound.EmbeddingPort;

import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Offline embedding provider based on signed feature hashing of lower-cased
 * words. The same text always maps to the same unit vector, and texts sharing
 * most of their words score close to 1 under cosine similarity.
 */
public class DeterministicEmbeddingAdapter implements EmbeddingPort {

    private static final Pattern WORD = Pattern.compile("\\w+", Pattern.UNICODE_CHARACTER_CLASS);

    private final int dimension;

    public DeterministicEmbeddingAdapter(int dimension) {
        if (dimension < 1) {
            throw new IllegalArgumentException("dimension must be >= 1");
        }
        this.dimension = dimension;
    }

    @Override
    public CompletableFuture<float[]> embed(String text) {
        return CompletableFuture.completedFuture(vectorize(text));
    }

    @Override
    public CompletableFuture<List<float[]>> embedBatch(List<String> texts) {
        return CompletableFuture.completedFuture(texts.stream().map(this::vectorize).toList());
    }

    float[] vectorize(String text) {
        float[] vector = new float[dimension];
        if (text == null) {
            return vector;
        }
        Matcher matcher = WORD.matcher(text.toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            byte[] hash = HashSupport.sha256(matcher.group());
            int bucket = (((hash[0] & 0xFF) << 24) | ((hash[1] & 0xFF) << 16) | ((hash[2] & 0xFF) << 8)
                    | (hash[3] & 0xFF)) & Integer.MAX_VALUE;
            float sign = (hash[4] & 1) == 0 ? 1f : -1f;
            vector[bucket % dimension] += sign;
        }
        double norm = 0;
        for (float v : vector) {
            norm += v * v;
        }
        if (norm > 0) {
            float scale = (float) (1.0 / Math.sqrt(norm));
            for (int i = 0; i < vector.length; i++) {
                vector[i] *= scale;
            }
        }
        return vector;
    }

    @Override
    public int getDimension() {
        return dimension;
    }

    @Override
    public String getModel() {
        return "deterministic-hash-" + dimension;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }
}
