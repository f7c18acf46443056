package me.wargame.mcp.tools;

import me.wargame.mcp.domain.model.MemoryAddResult;
import me.wargame.mcp.domain.model.ToolDefinition;
import me.wargame.mcp.domain.model.ToolFailureKind;
import me.wargame.mcp.domain.model.ToolResult;
import me.wargame.mcp.domain.model.ToolSource;
import me.wargame.mcp.domain.model.exception.MemoryBackendException;
import me.wargame.mcp.domain.service.MemoryGateway;
import me.wargame.mcp.infrastructure.config.WargameProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MemoryAddToolTest {

    private MemoryGateway gateway;
    private MemoryAddTool tool;

    @BeforeEach
    void setUp() {
        gateway = mock(MemoryGateway.class);
        tool = new MemoryAddTool(gateway, new WargameProperties());
    }

    @Test
    void shouldExposeDefinition() {
        ToolDefinition definition = tool.getDefinition();

        assertEquals("memory_add", definition.getName());
        assertEquals(ToolSource.MEMORY, definition.getSource());
        assertEquals(List.of("user_id", "memory"), definition.getInputSchema().get("required"));
    }

    @Test
    void shouldCreateWithDefaultScope() {
        when(gateway.add(eq("u1"), eq("user"), eq("Prefers terse briefs"), eq(List.of("style")), isNull(),
                eq("cid"))).thenReturn(MemoryAddResult.created("m-1"));

        ToolResult result = tool.execute(Map.of(
                "user_id", "u1",
                "memory", "Prefers terse briefs",
                "tags", List.of("style"),
                "correlation_id", "cid")).join();

        assertTrue(result.isSuccess());
        Map<?, ?> data = (Map<?, ?>) result.getData();
        assertEquals("m-1", data.get("memory_id"));
        assertEquals("created", data.get("status"));
        assertFalse(data.containsKey("reason"));
    }

    @Test
    void shouldReportDeduplicatedAsSuccess() {
        when(gateway.add(anyString(), anyString(), anyString(), any(), any(), any()))
                .thenReturn(MemoryAddResult.deduplicated("m-1"));

        ToolResult result = tool.execute(Map.of("user_id", "u1", "memory", "x", "scope", "scenario")).join();

        assertTrue(result.isSuccess());
        assertEquals("deduplicated", ((Map<?, ?>) result.getData()).get("status"));
        verify(gateway).add(eq("u1"), eq("scenario"), eq("x"), isNull(), isNull(), isNull());
    }

    @Test
    void shouldReportQuotaRejectionWithReason() {
        when(gateway.add(anyString(), anyString(), anyString(), any(), any(), any()))
                .thenReturn(MemoryAddResult.rejected(MemoryAddResult.REASON_QUOTA));

        ToolResult result = tool.execute(Map.of("user_id", "u1", "memory", "x")).join();

        assertTrue(result.isSuccess());
        Map<?, ?> data = (Map<?, ?>) result.getData();
        assertEquals("rejected_quota", data.get("status"));
        assertEquals("daily_quota_exceeded", data.get("reason"));
        assertNull(data.get("memory_id"));
    }

    @Test
    void shouldRejectMissingMemory() {
        ToolResult result = tool.execute(Map.of("user_id", "u1")).join();

        assertEquals(ToolFailureKind.INVALID_ARGUMENTS, result.getFailureKind());
        verify(gateway, never()).add(any(), any(), any(), any(), any(), any());
    }

    @Test
    void shouldRejectNonStringTags() {
        ToolResult result = tool.execute(Map.of("user_id", "u1", "memory", "x", "tags", List.of(1, 2))).join();

        assertEquals(ToolFailureKind.INVALID_ARGUMENTS, result.getFailureKind());
    }

    @Test
    void shouldReportBackendFailure() {
        when(gateway.add(anyString(), anyString(), anyString(), any(), any(), any()))
                .thenThrow(new MemoryBackendException("Mem0 request failed with status 502: "));

        ToolResult result = tool.execute(Map.of("user_id", "u1", "memory", "x")).join();

        assertFalse(result.isSuccess());
        assertEquals(ToolFailureKind.EXECUTION_FAILED, result.getFailureKind());
        assertTrue(result.getError().contains("502"));
    }
}
