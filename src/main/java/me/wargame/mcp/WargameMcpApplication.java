package me.wargame.mcp;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the wargame retrieval and memory service.
 *
 * <p>
 * The service lets an autonomous analyst agent answer questions from a
 * wargaming corpus (doctrine, after-action reports, scenarios, intel) and a
 * per-user long-term memory store.
 *
 * <h2>Key Features</h2>
 * <ul>
 * <li><b>Ingestion</b> - deterministic, structure-aware chunking and idempotent
 * per-document index replacement</li>
 * <li><b>Retrieval</b> - filtered semantic search, span expansion, collection
 * inventory and health probing</li>
 * <li><b>Memory</b> - deduplicated, quota-checked memory with background
 * consolidation</li>
 * <li><b>Tool loop</b> - bounded agent orchestration with circuit breaking,
 * retry/backoff and source fallback</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports & Adapters):
 *
 * <pre>
 * Input Layer        → REST controllers (tools, ingestion, agent sessions)
 * Domain Layer       → ChunkSegmenter, DocumentIngestor, KnowledgeRetriever,
 *                      MemoryGateway, ToolOrchestrator
 * Infrastructure     → Embedding / Index / Memory / Extraction adapters
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under the
 * {@code wargame.*} prefix.
 *
 * @version 1.0
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class WargameMcpApplication {

    public static void main(String[] args) {
        SpringApplication.run(WargameMcpApplication.class, args);
    }

}
