package me.wargame.mcp.domain.model;

/**
 * A metadata value that failed validation and was replaced by a default.
 */
public record MetadataWarning(String field, String message) {
}
