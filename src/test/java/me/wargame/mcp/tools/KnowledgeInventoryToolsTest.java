package me.wargame.mcp.tools;

import me.wargame.mcp.domain.model.CollectionSummary;
import me.wargame.mcp.domain.model.HealthReport;
import me.wargame.mcp.domain.model.ToolResult;
import me.wargame.mcp.domain.service.KnowledgeRetriever;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class KnowledgeInventoryToolsTest {

    private KnowledgeRetriever retriever;

    @BeforeEach
    void setUp() {
        retriever = mock(KnowledgeRetriever.class);
    }

    @Test
    void listCollectionsShouldReturnInventory() {
        when(retriever.listCollections()).thenReturn(List.of(
                new CollectionSummary("aar", 4, "After-action reports and lessons learned"),
                new CollectionSummary("doctrine", 12, "Doctrine publications and field manuals")));

        ToolResult result = new ListCollectionsTool(retriever).execute(Map.of()).join();

        assertTrue(result.isSuccess());
        @SuppressWarnings("unchecked")
        List<Map<String, Object>> collections = (List<Map<String, Object>>) ((Map<String, Object>) result
                .getData()).get("collections");
        assertEquals(2, collections.size());
        assertEquals("doctrine", collections.get(1).get("name"));
        assertEquals(12L, collections.get(1).get("document_count"));
        assertEquals("After-action reports and lessons learned", collections.get(0).get("description"));
    }

    @Test
    void listCollectionsShouldAcceptNullParameters() {
        when(retriever.listCollections()).thenReturn(List.of());

        ToolResult result = new ListCollectionsTool(retriever).execute(null).join();

        assertTrue(result.isSuccess());
        assertEquals("0 collections", result.getOutput());
    }

    @Test
    void healthCheckShouldSucceedEvenWhenIndexIsDown() {
        when(retriever.healthCheck()).thenReturn(HealthReport.builder()
                .status(HealthReport.Status.ERROR)
                .details("index unreachable: connection refused")
                .build());

        ToolResult result = new HealthCheckTool(retriever).execute(Map.of()).join();

        assertTrue(result.isSuccess());
        Map<?, ?> data = (Map<?, ?>) result.getData();
        assertEquals("error", data.get("status"));
        assertEquals("index unreachable: connection refused", data.get("details"));
    }

    @Test
    void healthCheckShouldReportOk() {
        when(retriever.healthCheck()).thenReturn(HealthReport.builder()
                .status(HealthReport.Status.OK)
                .details("2 chunks indexed across 1 documents in 1 collections")
                .build());

        ToolResult result = new HealthCheckTool(retriever).execute(Map.of("correlation_id", "cid")).join();

        assertEquals("ok", ((Map<?, ?>) result.getData()).get("status"));
        assertEquals("health_check", new HealthCheckTool(retriever).getToolName());
    }
}
