package me.wargame.mcp.domain.model;

import java.util.List;

/**
 * Metadata after the fallback chain, with the corrections that were applied.
 */
public record ResolvedMetadata(DocumentMetadata metadata, List<MetadataWarning> warnings) {
}
