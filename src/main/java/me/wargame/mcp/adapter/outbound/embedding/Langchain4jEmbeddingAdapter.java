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

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import dev.langchain4j.model.output.Response;
import lombok.extern.slf4j.Slf4j;
import me.wargame.mcp.domain.model.exception.ConfigurationException;
import me.wargame.mcp.infrastructure.config.WargameProperties;
import me.wargame.mcp.port.outbound.EmbeddingPort;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Embedding adapter using langchain4j and OpenAI.
 *
 * <p>
 * Default model: text-embedding-3-large, reduced to
 * {@code wargame.embedding.dimensions} dimensions.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code wargame.embedding.api-key} - OpenAI API key (required)
 * <li>{@code wargame.embedding.model} - Embedding model name
 * <li>{@code wargame.embedding.base-url} - Optional OpenAI-compatible endpoint
 * </ul>
 *
 * @see me.wargame.mcp.port.outbound.EmbeddingPort
 */
@Slf4j
public class Langchain4jEmbeddingAdapter implements EmbeddingPort {

    private static final String DEFAULT_MODEL = "text-embedding-3-large";

    private final WargameProperties.EmbeddingProperties config;

    private volatile EmbeddingModel embeddingModel;
    private volatile boolean initialized = false;

    public Langchain4jEmbeddingAdapter(WargameProperties.EmbeddingProperties config) {
        if (config.getApiKey() == null || config.getApiKey().isBlank()) {
            throw new ConfigurationException("wargame.embedding.api-key is required for the openai provider");
        }
        this.config = config;
    }

    /**
     * Visible for testing: wraps an already-built model.
     */
    Langchain4jEmbeddingAdapter(WargameProperties.EmbeddingProperties config, EmbeddingModel model) {
        this.config = config;
        this.embeddingModel = model;
        this.initialized = true;
    }

    private synchronized void ensureInitialized() {
        if (initialized)
            return;

        try {
            var builder = OpenAiEmbeddingModel.builder()
                    .apiKey(config.getApiKey())
                    .modelName(getModel())
                    .dimensions(config.getDimensions())
                    .timeout(Duration.ofMillis(config.getTimeoutMs()));
            if (config.getBaseUrl() != null && !config.getBaseUrl().isBlank()) {
                builder.baseUrl(config.getBaseUrl());
            }
            embeddingModel = builder.build();
            log.info("[Embedding] Model initialized: {} ({} dims)", getModel(), config.getDimensions());
        } catch (RuntimeException e) {
            log.error("[Embedding] Failed to initialize embedding model", e);
        }

        initialized = true;
    }

    @Override
    public CompletableFuture<float[]> embed(String text) {
        return CompletableFuture.supplyAsync(() -> {
            ensureInitialized();

            if (embeddingModel == null) {
                throw new IllegalStateException("Embedding model not available");
            }

            Response<Embedding> response = embeddingModel.embed(text);
            return response.content().vector();
        });
    }

    @Override
    public CompletableFuture<List<float[]>> embedBatch(List<String> texts) {
        return CompletableFuture.supplyAsync(() -> {
            ensureInitialized();

            if (embeddingModel == null) {
                throw new IllegalStateException("Embedding model not available");
            }

            List<TextSegment> segments = texts.stream()
                    .map(TextSegment::from)
                    .toList();

            Response<List<Embedding>> response = embeddingModel.embedAll(segments);

            List<float[]> vectors = response.content().stream()
                    .map(Embedding::vector)
                    .toList();
            if (vectors.size() != texts.size()) {
                throw new IllegalStateException(
                        "Embedding provider returned " + vectors.size() + " vectors for " + texts.size() + " texts");
            }
            return vectors;
        });
    }

    @Override
    public int getDimension() {
        return config.getDimensions();
    }

    @Override
    public String getModel() {
        String model = config.getModel();
        return model != null && !model.isBlank() ? model : DEFAULT_MODEL;
    }

    @Override
    public boolean isAvailable() {
        ensureInitialized();
        return embeddingModel != null;
    }
}
