package me.wargame.mcp.tools;

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
import me.wargame.mcp.domain.component.ToolComponent;
import me.wargame.mcp.domain.model.ToolFailureKind;
import me.wargame.mcp.domain.model.ToolResult;
import me.wargame.mcp.domain.model.exception.ToolInvocationException;
import me.wargame.mcp.domain.service.CorrelationSupport;
import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Shared execution frame of the v1 tools: binds the caller's correlation id to
 * the MDC and turns exceptions into classified {@link ToolResult} failures.
 */
@Slf4j
abstract class AbstractWargameTool implements ToolComponent {

    @Override
    public final CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        ToolArguments arguments = new ToolArguments(parameters);
        try (MDC.MDCCloseable ignored = CorrelationSupport.bind(arguments.correlationId())) {
            return CompletableFuture.completedFuture(run(arguments));
        } catch (IllegalArgumentException e) {
            log.debug("[Tool] {} rejected arguments: {}", getToolName(), e.getMessage());
            return CompletableFuture.completedFuture(ToolResult.failure(ToolFailureKind.INVALID_ARGUMENTS,
                    e.getMessage()));
        } catch (ToolInvocationException e) {
            log.warn("[Tool] {} failed: {}", getToolName(), e.getMessage());
            return CompletableFuture.completedFuture(ToolResult.failure(ToolFailureKind.EXECUTION_FAILED,
                    e.getMessage()));
        } catch (RuntimeException e) {
            log.warn("[Tool] {} failed unexpectedly", getToolName(), e);
            return CompletableFuture.completedFuture(ToolResult.failure(ToolFailureKind.EXECUTION_FAILED,
                    getToolName() + " failed: " + e.getMessage()));
        }
    }

    protected abstract ToolResult run(ToolArguments arguments);

    /**
     * JSON Schema object with the shared optional {@code correlation_id}
     * property appended.
     */
    protected static Map<String, Object> objectSchema(Map<String, Object> properties, List<String> required) {
        Map<String, Object> all = new LinkedHashMap<>(properties);
        all.put(PARAM_CORRELATION_ID, Map.of("type", "string",
                "description", "Optional id threaded through to backends for tracing"));
        return Map.of(
                "type", "object",
                "properties", all,
                "required", required);
    }
}
