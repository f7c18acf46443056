package me.wargame.mcp.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Ingestion request: explicit file paths, a directory to walk, or both.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestRequest {
    @Builder.Default
    private List<String> paths = new ArrayList<>();
    private String directory;
}
