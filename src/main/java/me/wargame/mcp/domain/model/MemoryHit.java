package me.wargame.mcp.domain.model;

import java.util.Map;

/**
 * Memory search hit with similarity score in [0, 1].
 */
public record MemoryHit(MemoryRecord record, double score) {

    public Map<String, Object> toMap() {
        Map<String, Object> map = record.toMap();
        map.put("score", score);
        return map;
    }
}
