package me.wargame.mcp.domain.system.toolloop;

import me.wargame.mcp.domain.model.ToolCall;
import me.wargame.mcp.domain.model.ToolResult;

import java.util.concurrent.Future;

/**
 * Port for executing a single tool call on behalf of the tool loop. The
 * returned future may be cancelled with interruption when the call or the
 * session runs out of time.
 */
public interface ToolExecutorPort {

    Future<ToolResult> submit(ToolCall toolCall);
}
