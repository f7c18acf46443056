package me.wargame.mcp.domain.model;

/**
 * Index hit with its similarity score in [0, 1].
 */
public record ScoredChunk(DocumentChunk chunk, double score) {
}
