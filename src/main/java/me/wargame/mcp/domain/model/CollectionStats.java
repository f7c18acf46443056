package me.wargame.mcp.domain.model;

/**
 * Per-collection counts as reported by the index.
 */
public record CollectionStats(String name, long documentCount, long chunkCount) {
}
