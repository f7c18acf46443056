package me.wargame.mcp.domain.model;

import java.util.Set;

/**
 * Restriction applied by the index before scoring. An empty collection set
 * means all collections.
 */
public record IndexFilter(Set<DocumentCollection> collections) {

    public static IndexFilter none() {
        return new IndexFilter(Set.of());
    }

    public boolean accepts(DocumentChunk chunk) {
        if (collections == null || collections.isEmpty()) {
            return true;
        }
        DocumentMetadata metadata = chunk.getMetadata();
        DocumentCollection collection = metadata != null ? metadata.getCollection() : DocumentCollection.OTHER;
        return collections.contains(collection);
    }
}
