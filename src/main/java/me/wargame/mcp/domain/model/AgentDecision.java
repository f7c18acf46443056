package me.wargame.mcp.domain.model;

/**
 * What the driving agent wants next: another tool call, or to stop because it
 * has enough information.
 */
public record AgentDecision(ToolCall toolCall, boolean complete) {

    public static AgentDecision call(ToolCall toolCall) {
        return new AgentDecision(toolCall, false);
    }

    public static AgentDecision finish() {
        return new AgentDecision(null, true);
    }
}
