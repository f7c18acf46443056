package me.wargame.mcp.domain.model;

/**
 * A chunk together with its embedding vector, as written to the index.
 */
public record IndexedChunk(DocumentChunk chunk, float[] vector) {
}
