package me.wargame.mcp.domain.model;

/**
 * Result accumulated by a session. {@code executedTool} differs from
 * {@code requestedTool} when the call ran on the fallback source.
 */
public record SessionToolResult(String requestedTool, String executedTool, boolean fallback, String output,
        Object data) {
}
