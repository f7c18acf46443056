package me.wargame.mcp.domain.system.toolloop;

import me.wargame.mcp.domain.component.ToolComponent;
import me.wargame.mcp.domain.model.AgentDecision;
import me.wargame.mcp.domain.model.OrchestrationSession;
import me.wargame.mcp.domain.model.SessionToolResult;
import me.wargame.mcp.domain.model.ToolCall;
import me.wargame.mcp.port.outbound.AgentDriver;
import me.wargame.mcp.tools.GetDocSpanTool;
import me.wargame.mcp.tools.MemorySearchTool;
import me.wargame.mcp.tools.SearchWargameDocsTool;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Scripted analyst policy: recall the user's memories, search the corpus, then
 * widen the context around the best passage.
 */
public class MemoryFirstAgentDriver implements AgentDriver {

    private final int span;

    public MemoryFirstAgentDriver(int span) {
        this.span = span;
    }

    @Override
    public AgentDecision nextAction(OrchestrationSession session) {
        if (!session.isResolved(MemorySearchTool.TOOL_NAME)) {
            Map<String, Object> args = baseArguments(session);
            args.put("query", session.getQuestion());
            if (session.getUserId() != null) {
                args.put("user_id", session.getUserId());
            }
            return AgentDecision.call(new ToolCall(MemorySearchTool.TOOL_NAME, args));
        }
        if (!session.isResolved(SearchWargameDocsTool.TOOL_NAME)) {
            Map<String, Object> args = baseArguments(session);
            args.put("query", session.getQuestion());
            return AgentDecision.call(new ToolCall(SearchWargameDocsTool.TOOL_NAME, args));
        }
        if (!session.isResolved(GetDocSpanTool.TOOL_NAME)) {
            Optional<Map<?, ?>> best = bestPassage(session);
            if (best.isPresent()) {
                Map<String, Object> args = baseArguments(session);
                args.put("document_id", best.get().get("document_id"));
                args.put("center_chunk_index", best.get().get("chunk_index"));
                args.put("span", span);
                return AgentDecision.call(new ToolCall(GetDocSpanTool.TOOL_NAME, args));
            }
        }
        return AgentDecision.finish();
    }

    private Map<String, Object> baseArguments(OrchestrationSession session) {
        Map<String, Object> args = new LinkedHashMap<>();
        args.put(ToolComponent.PARAM_CORRELATION_ID, session.getCorrelationId());
        return args;
    }

    /**
     * Metadata of the top corpus hit, if the corpus search ran and matched.
     */
    static Optional<Map<?, ?>> bestPassage(OrchestrationSession session) {
        for (SessionToolResult result : session.getAccumulatedResults()) {
            if (!SearchWargameDocsTool.TOOL_NAME.equals(result.executedTool())
                    || !(result.data() instanceof Map<?, ?> data)
                    || !(data.get("results") instanceof List<?> hits)
                    || hits.isEmpty()
                    || !(hits.get(0) instanceof Map<?, ?> top)
                    || !(top.get("metadata") instanceof Map<?, ?> metadata)) {
                continue;
            }
            if (metadata.get("document_id") != null && metadata.get("chunk_index") != null) {
                return Optional.of(metadata);
            }
        }
        return Optional.empty();
    }
}
