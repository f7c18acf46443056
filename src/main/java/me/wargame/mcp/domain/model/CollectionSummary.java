package me.wargame.mcp.domain.model;

/**
 * Collection inventory entry exposed by {@code list_collections}.
 */
public record CollectionSummary(String name, long documentCount, String description) {
}
