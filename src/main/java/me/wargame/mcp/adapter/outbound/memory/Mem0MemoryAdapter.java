package me.wargame.mcp.adapter.outbound.memory;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.wargame.mcp.domain.model.MemoryHit;
import me.wargame.mcp.domain.model.MemoryRecord;
import me.wargame.mcp.domain.model.MemoryScope;
import me.wargame.mcp.domain.model.exception.ConfigurationException;
import me.wargame.mcp.domain.model.exception.MemoryBackendException;
import me.wargame.mcp.domain.service.CorrelationSupport;
import me.wargame.mcp.infrastructure.config.WargameProperties;
import me.wargame.mcp.port.outbound.MemoryBackendPort;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Mem0 adapter, talks to the Mem0 REST API over HTTP.
 *
 * <p>
 * Endpoints:
 * <ul>
 * <li>POST /memories/search - similarity search for one user
 * <li>POST /memories - store a memory
 * <li>PUT /memories/{id} - rewrite a memory (consolidation)
 * <li>DELETE /memories/{id} - delete a memory
 * <li>GET /memories - list memories of a user
 * </ul>
 *
 * <p>
 * Every request carries {@code Accept: application/json}, the optional Bearer
 * API key and the caller's {@code X-Correlation-ID}. Non-2xx responses and
 * transport failures surface as {@link MemoryBackendException}.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code wargame.memory.base-url} - Mem0 API base URL (required)
 * <li>{@code wargame.memory.api-key} - Optional API key
 * <li>{@code wargame.memory.timeout-seconds} - HTTP timeout
 * </ul>
 */
@Slf4j
public class Mem0MemoryAdapter implements MemoryBackendPort {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final String MEMORIES = "memories";

    private final HttpUrl baseUrl;
    private final String apiKey;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public Mem0MemoryAdapter(WargameProperties.MemoryProperties config, OkHttpClient baseHttpClient,
            ObjectMapper objectMapper) {
        String url = config.getBaseUrl();
        if (url == null || url.isBlank()) {
            throw new ConfigurationException("wargame.memory.base-url is required for the mem0 backend");
        }
        HttpUrl parsed = HttpUrl.parse(url.trim());
        if (parsed == null) {
            throw new ConfigurationException("wargame.memory.base-url is not a valid URL: " + url);
        }
        this.baseUrl = parsed;
        this.apiKey = config.getApiKey();
        this.objectMapper = objectMapper;

        // Dedicated client with memory-specific timeout
        int timeoutSeconds = config.getTimeoutSeconds();
        this.httpClient = baseHttpClient.newBuilder()
                .callTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .readTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .build();
    }

    @Override
    public List<MemoryHit> search(String query, String userId, int limit, Set<MemoryScope> scopes,
            String correlationId) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("query", query);
        payload.put("user_id", userId);
        payload.put("limit", limit);
        if (scopes != null && !scopes.isEmpty()) {
            payload.put("scopes", scopes.stream().map(MemoryScope::getValue).sorted().toList());
        }
        JsonNode data = execute(post(url(MEMORIES, "search"), payload), correlationId, "search");

        List<MemoryHit> hits = new ArrayList<>();
        for (JsonNode node : results(data)) {
            double score = node.path("score").asDouble(0.0);
            hits.add(new MemoryHit(parseRecord(node, userId), Math.max(0.0, Math.min(1.0, score))));
        }
        return hits;
    }

    @Override
    public MemoryRecord add(MemoryRecord record, String correlationId) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("user_id", record.getUserId());
        payload.put("memory", record.getMemory());
        payload.put("scope", record.getScope().getValue());
        payload.put("tags", record.getTags());
        if (record.getSource() != null && !record.getSource().isBlank()) {
            payload.put("source", record.getSource());
        }
        payload.put("importance", record.getImportance());
        JsonNode data = execute(post(url(MEMORIES), payload), correlationId, "add");

        String memoryId = firstText(data, "memory_id", "id");
        if (memoryId == null) {
            throw new MemoryBackendException("Mem0 add response carried no memory id");
        }
        record.setMemoryId(memoryId);
        return record;
    }

    @Override
    public MemoryRecord update(MemoryRecord record, String correlationId) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("memory", record.getMemory());
        payload.put("tags", record.getTags());
        payload.put("importance", record.getImportance());
        if (record.getUpdatedAt() != null) {
            payload.put("updated_at", record.getUpdatedAt().toString());
        }
        Request.Builder request = new Request.Builder()
                .url(url(MEMORIES, record.getMemoryId()))
                .put(RequestBody.create(toJson(payload), JSON));
        execute(request, correlationId, "update");
        return record;
    }

    @Override
    public boolean delete(String memoryId, String correlationId) {
        Request.Builder request = new Request.Builder().url(url(MEMORIES, memoryId)).delete();
        addHeaders(request, correlationId);
        try (Response response = httpClient.newCall(request.build()).execute()) {
            if (response.code() == 404) {
                return false;
            }
            if (!response.isSuccessful()) {
                throw failure("delete", response);
            }
            return true;
        } catch (IOException e) {
            log.warn("[Mem0] delete error: {}", e.getMessage());
            throw new MemoryBackendException("Mem0 request error: " + e.getMessage(), e);
        }
    }

    @Override
    public List<MemoryRecord> list(String userId, int limit, MemoryScope scope, Set<String> tags,
            String correlationId) {
        HttpUrl.Builder url = baseUrl.newBuilder()
                .addPathSegment(MEMORIES)
                .addQueryParameter("user_id", userId)
                .addQueryParameter("limit", String.valueOf(limit));
        if (scope != null) {
            url.addQueryParameter("scope", scope.getValue());
        }
        if (tags != null && !tags.isEmpty()) {
            url.addQueryParameter("tags", String.join(",", tags));
        }
        JsonNode data = execute(new Request.Builder().url(url.build()).get(), correlationId, "list");

        List<MemoryRecord> records = new ArrayList<>();
        for (JsonNode node : results(data)) {
            records.add(parseRecord(node, userId));
        }
        return records;
    }

    private Request.Builder post(HttpUrl url, Object payload) {
        return new Request.Builder().url(url).post(RequestBody.create(toJson(payload), JSON));
    }

    private HttpUrl url(String... segments) {
        HttpUrl.Builder builder = baseUrl.newBuilder();
        for (String segment : segments) {
            builder.addPathSegment(segment);
        }
        return builder.build();
    }

    private JsonNode execute(Request.Builder request, String correlationId, String operation) {
        addHeaders(request, correlationId);
        try (Response response = httpClient.newCall(request.build()).execute()) {
            if (!response.isSuccessful()) {
                throw failure(operation, response);
            }
            ResponseBody body = response.body();
            String content = body != null ? body.string() : "";
            if (content.isBlank()) {
                return objectMapper.createObjectNode();
            }
            return objectMapper.readTree(content);
        } catch (JsonProcessingException e) {
            throw new MemoryBackendException("Mem0 response did not contain valid JSON", e);
        } catch (IOException e) {
            log.warn("[Mem0] {} error: {}", operation, e.getMessage());
            throw new MemoryBackendException("Mem0 request error: " + e.getMessage(), e);
        }
    }

    private MemoryBackendException failure(String operation, Response response) throws IOException {
        ResponseBody body = response.body();
        String text = body != null ? body.string() : "";
        log.warn("[Mem0] {} failed: HTTP {}", operation, response.code());
        return new MemoryBackendException("Mem0 request failed with status " + response.code() + ": " + text);
    }

    private void addHeaders(Request.Builder builder, String correlationId) {
        builder.header("Accept", "application/json");
        if (apiKey != null && !apiKey.isBlank()) {
            builder.header("Authorization", "Bearer " + apiKey);
        }
        if (correlationId != null && !correlationId.isBlank()) {
            builder.header(CorrelationSupport.HEADER, correlationId);
        }
    }

    private String toJson(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new MemoryBackendException("Cannot serialize Mem0 request", e);
        }
    }

    /**
     * Mem0 answers either {@code {"results": [...]}} or a bare array.
     */
    private static Iterable<JsonNode> results(JsonNode data) {
        if (data.isArray()) {
            return data;
        }
        JsonNode results = data.path("results");
        return results.isArray() ? results : List.of();
    }

    private MemoryRecord parseRecord(JsonNode node, String fallbackUserId) {
        List<String> tags = new ArrayList<>();
        node.path("tags").forEach(tag -> tags.add(tag.asText()));
        String userId = firstText(node, "user_id");
        return MemoryRecord.builder()
                .memoryId(firstText(node, "memory_id", "id"))
                .userId(userId != null ? userId : fallbackUserId)
                .scope(MemoryScope.fromValue(firstText(node, "scope")).orElse(MemoryScope.USER))
                .memory(node.path("memory").asText(""))
                .tags(tags)
                .source(firstText(node, "source"))
                .importance(node.path("importance").asDouble(1.0))
                .createdAt(parseInstant(firstText(node, "created_at")))
                .updatedAt(parseInstant(firstText(node, "updated_at")))
                .build();
    }

    private static String firstText(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && !value.isNull() && !value.asText().isBlank()) {
                return value.asText();
            }
        }
        return null;
    }

    private static Instant parseInstant(String value) {
        if (value == null) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            log.debug("[Mem0] Unparseable timestamp '{}'", value);
            return null;
        }
    }
}
