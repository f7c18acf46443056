package me.wargame.mcp.domain.model;

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

import java.util.Locale;

/**
 * Vector similarity used by the index and the memory store. Scores are
 * clamped to [0, 1].
 */
public enum SimilarityMetric {

    COSINE {
        @Override
        double raw(float[] a, float[] b) {
            double dotProduct = 0;
            double normA = 0;
            double normB = 0;
            for (int i = 0; i < a.length; i++) {
                dotProduct += a[i] * b[i];
                normA += a[i] * a[i];
                normB += b[i] * b[i];
            }
            if (normA == 0 || normB == 0) {
                return 0;
            }
            return dotProduct / (Math.sqrt(normA) * Math.sqrt(normB));
        }
    },

    /**
     * Plain inner product; only meaningful for unit-normalized vectors.
     */
    DOT_PRODUCT {
        @Override
        double raw(float[] a, float[] b) {
            double dotProduct = 0;
            for (int i = 0; i < a.length; i++) {
                dotProduct += a[i] * b[i];
            }
            return dotProduct;
        }
    };

    abstract double raw(float[] a, float[] b);

    public double score(float[] a, float[] b) {
        if (a == null || b == null || a.length == 0 || a.length != b.length) {
            return 0;
        }
        double value = raw(a, b);
        return Math.max(0.0, Math.min(1.0, value));
    }

    public static SimilarityMetric fromName(String name) {
        if (name == null || name.isBlank()) {
            return COSINE;
        }
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
        case "dot", "dot_product", "dot-product" -> DOT_PRODUCT;
        case "cosine" -> COSINE;
        default -> throw new IllegalArgumentException("Unknown similarity metric: " + name);
        };
    }
}
