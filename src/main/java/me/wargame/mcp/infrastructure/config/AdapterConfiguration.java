package me.wargame.mcp.infrastructure.config;

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

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.wargame.mcp.adapter.outbound.embedding.DeterministicEmbeddingAdapter;
import me.wargame.mcp.adapter.outbound.embedding.Langchain4jEmbeddingAdapter;
import me.wargame.mcp.adapter.outbound.memory.LocalMemoryAdapter;
import me.wargame.mcp.adapter.outbound.memory.Mem0MemoryAdapter;
import me.wargame.mcp.domain.model.SimilarityMetric;
import me.wargame.mcp.domain.model.exception.ConfigurationException;
import me.wargame.mcp.port.outbound.EmbeddingPort;
import me.wargame.mcp.port.outbound.MemoryBackendPort;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Locale;

/**
 * Selects the outbound adapters named in configuration.
 *
 * <ul>
 * <li>{@code wargame.embedding.provider}: {@code fake} (offline, default) or
 * {@code openai}</li>
 * <li>{@code wargame.memory.backend}: {@code local} (default) or
 * {@code mem0}</li>
 * </ul>
 */
@Configuration
@Slf4j
public class AdapterConfiguration {

    @Bean
    public EmbeddingPort embeddingPort(WargameProperties properties) {
        WargameProperties.EmbeddingProperties embedding = properties.getEmbedding();
        String provider = normalize(embedding.getProvider());
        log.info("[Config] Embedding provider: {}", provider);
        return switch (provider) {
        case "fake" -> new DeterministicEmbeddingAdapter(embedding.getDimensions());
        case "openai" -> new Langchain4jEmbeddingAdapter(embedding);
        default -> throw new ConfigurationException("Unknown wargame.embedding.provider: " + provider);
        };
    }

    @Bean
    public MemoryBackendPort memoryBackendPort(WargameProperties properties, EmbeddingPort embeddingPort,
            OkHttpClient okHttpClient, ObjectMapper objectMapper) {
        WargameProperties.MemoryProperties memory = properties.getMemory();
        String backend = normalize(memory.getBackend());
        log.info("[Config] Memory backend: {}", backend);
        return switch (backend) {
        case "local" -> new LocalMemoryAdapter(embeddingPort,
                SimilarityMetric.fromName(properties.getRetrieval().getSimilarityMetric()));
        case "mem0" -> new Mem0MemoryAdapter(memory, okHttpClient, objectMapper);
        default -> throw new ConfigurationException("Unknown wargame.memory.backend: " + backend);
        };
    }

    private static String normalize(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }
}
