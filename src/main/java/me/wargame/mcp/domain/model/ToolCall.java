package me.wargame.mcp.domain.model;

import java.util.Map;

/**
 * A tool invocation requested by the driving agent.
 */
public record ToolCall(String name, Map<String, Object> arguments) {

    public ToolCall {
        arguments = arguments != null ? Map.copyOf(arguments) : Map.of();
    }
}
