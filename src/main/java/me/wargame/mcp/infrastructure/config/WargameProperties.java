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

import jakarta.annotation.PostConstruct;
import lombok.Data;
import me.wargame.mcp.domain.model.exception.ConfigurationException;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Centralized configuration properties, bound from application.properties.
 *
 * <p>
 * All configuration is organized under the {@code wargame.*} prefix. Every
 * recognized option is declared here with its default:
 * <ul>
 * <li>{@link ChunkingProperties} - segmentation window and tokenizer</li>
 * <li>{@link IngestionProperties} - worker pool and embedding batching</li>
 * <li>{@link EmbeddingProperties} - embedding provider selection</li>
 * <li>{@link IndexProperties} - vector index snapshot and collection
 * descriptions</li>
 * <li>{@link RetrievalProperties} - search defaults and similarity metric</li>
 * <li>{@link MemoryProperties} - memory backend, dedup, quota and
 * consolidation</li>
 * <li>{@link OrchestratorProperties} - tool loop limits, circuit breaker and
 * retry policy</li>
 * <li>{@link HttpProperties} - shared OkHttp client</li>
 * <li>{@link McpProperties} - MCP streamable HTTP endpoint and server info</li>
 * </ul>
 *
 * <p>
 * The values are validated once after binding; an invalid combination fails
 * startup with a {@link ConfigurationException}.
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "wargame")
@Data
public class WargameProperties {

    private ChunkingProperties chunking = new ChunkingProperties();
    private IngestionProperties ingestion = new IngestionProperties();
    private EmbeddingProperties embedding = new EmbeddingProperties();
    private IndexProperties index = new IndexProperties();
    private RetrievalProperties retrieval = new RetrievalProperties();
    private MemoryProperties memory = new MemoryProperties();
    private OrchestratorProperties orchestrator = new OrchestratorProperties();
    private HttpProperties http = new HttpProperties();
    private McpProperties mcp = new McpProperties();

    @PostConstruct
    public void validate() {
        if (chunking.getMaxTokens() <= 0) {
            throw new ConfigurationException("wargame.chunking.max-tokens must be > 0");
        }
        if (chunking.getOverlapTokens() < 0 || chunking.getOverlapTokens() >= chunking.getMaxTokens()) {
            throw new ConfigurationException(
                    "wargame.chunking.overlap-tokens must be >= 0 and < max-tokens");
        }
        if (ingestion.getWorkers() < 1) {
            throw new ConfigurationException("wargame.ingestion.workers must be >= 1");
        }
        if (ingestion.getEmbeddingBatchSize() < 1) {
            throw new ConfigurationException("wargame.ingestion.embedding-batch-size must be >= 1");
        }
        if (memory.getDedupThreshold() <= 0 || memory.getDedupThreshold() > 1) {
            throw new ConfigurationException("wargame.memory.dedup-threshold must be in (0, 1]");
        }
        if (memory.getMaxLength() < 1 || memory.getDailyQuota() < 1) {
            throw new ConfigurationException("wargame.memory.max-length and daily-quota must be >= 1");
        }
        if (orchestrator.getMaxToolIterations() < 1 || orchestrator.getMaxConsecutiveFailedTools() < 1) {
            throw new ConfigurationException(
                    "wargame.orchestrator.max-tool-iterations and max-consecutive-failed-tools must be >= 1");
        }
        RetryProperties retry = orchestrator.getRetry();
        if (retry.getMaxRetries() < 0 || retry.getBaseDelayMs() < 0 || retry.getMaxDelayMs() < retry.getBaseDelayMs()) {
            throw new ConfigurationException("wargame.orchestrator.retry delays are inconsistent");
        }
        if (retry.getJitter() < 0 || retry.getJitter() > 1) {
            throw new ConfigurationException("wargame.orchestrator.retry.jitter must be in [0, 1]");
        }
        if (mcp.getEndpoint() == null || !mcp.getEndpoint().startsWith("/")) {
            throw new ConfigurationException("wargame.mcp.endpoint must start with '/'");
        }
    }

    @Data
    public static class ChunkingProperties {
        private int maxTokens = 800;
        private int overlapTokens = 200;
        private String tokenizer = "model";
    }

    @Data
    public static class IngestionProperties {
        private int workers = 4;
        private int embeddingBatchSize = 64;
        private List<String> supportedExtensions = new ArrayList<>(List.of("txt", "md", "markdown", "pdf", "docx"));
        private String sidecarSuffix = ".meta.yml";
    }

    @Data
    public static class EmbeddingProperties {
        private String provider = "fake";
        private String model = "text-embedding-3-large";
        private String apiKey;
        private String baseUrl;
        private int dimensions = 256;
        private long timeoutMs = 30000;
    }

    @Data
    public static class IndexProperties {
        private String snapshotPath;
        private Map<String, String> collectionDescriptions = new LinkedHashMap<>(Map.of(
                "doctrine", "Doctrine publications and field manuals",
                "aar", "After-action reports and lessons learned",
                "scenario", "Wargame scenarios and vignettes",
                "intel", "Intelligence estimates and threat assessments",
                "other", "Uncategorized material"));
    }

    @Data
    public static class RetrievalProperties {
        private int defaultTopK = 8;
        private double defaultMinScore = 0.0;
        private int defaultSpan = 2;
        private String similarityMetric = "cosine";
    }

    @Data
    public static class MemoryProperties {
        private String backend = "local";
        private String baseUrl;
        private String apiKey;
        private int timeoutSeconds = 10;
        private double dedupThreshold = 0.9;
        private boolean dedupWithinScope = false;
        private int maxLength = 2000;
        private int dailyQuota = 200;
        private int defaultLimit = 5;
        private String defaultScope = "user";
        private double initialImportance = 1.0;
        private ConsolidationProperties consolidation = new ConsolidationProperties();
    }

    @Data
    public static class ConsolidationProperties {
        private boolean enabled = true;
        private long intervalMinutes = 60;
        private int ttlDays = 180;
        private double halfLifeDays = 30.0;
        private double mergeThreshold = 0.97;
        private int scanLimit = 500;
    }

    @Data
    public static class OrchestratorProperties {
        private int maxToolIterations = 8;
        private int maxConsecutiveFailedTools = 3;
        private long circuitCooldownMs = 30000;
        private long sessionTimeoutMs = 60000;
        private long callTimeoutMs = 10000;
        private RetryProperties retry = new RetryProperties();
    }

    @Data
    public static class RetryProperties {
        private int maxRetries = 2;
        private long baseDelayMs = 1000;
        private long maxDelayMs = 8000;
        private double jitter = 0.0;
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }

    @Data
    public static class McpProperties {
        private String endpoint = "/mcp";
        private boolean disallowDelete = false;
        private String serverName = "wargame-mcp";
        private String serverVersion = "1.0.0";
    }
}
