package me.wargame.mcp.adapter.inbound.web.controller;

import me.wargame.mcp.adapter.inbound.web.dto.IngestRequest;
import me.wargame.mcp.domain.model.BatchReport;
import me.wargame.mcp.domain.model.IngestionStage;
import me.wargame.mcp.domain.service.DocumentIngestor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import reactor.test.StepVerifier;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class IngestionControllerTest {

    private DocumentIngestor documentIngestor;
    private IngestionController controller;

    @BeforeEach
    void setUp() {
        documentIngestor = mock(DocumentIngestor.class);
        controller = new IngestionController(documentIngestor);
    }

    @Test
    void shouldIngestExplicitPaths() {
        BatchReport report = report("a.md", "doc-a", Instant.parse("2024-01-01T00:00:00Z"));
        when(documentIngestor.ingest(List.of(Path.of("a.md")))).thenReturn(report);

        StepVerifier.create(controller.ingest(IngestRequest.builder().paths(List.of("a.md")).build()))
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    assertEquals(1, response.getBody().getSucceededCount());
                })
                .verifyComplete();
        verify(documentIngestor, never()).ingestDirectory(any());
    }

    @Test
    void shouldIngestDirectory() {
        BatchReport report = BatchReport.builder().build();
        report.getFailed().add(new BatchReport.FailedDocument("corpus/bad.pdf", IngestionStage.EXTRACT, "corrupt"));
        when(documentIngestor.ingestDirectory(Path.of("corpus"))).thenReturn(report);

        StepVerifier.create(controller.ingest(IngestRequest.builder().directory("corpus").build()))
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    assertEquals(1, response.getBody().getFailedCount());
                })
                .verifyComplete();
        verify(documentIngestor, never()).ingest(any());
    }

    @Test
    void shouldMergeDirectoryAndExplicitBatches() {
        Instant start = Instant.parse("2024-01-01T00:00:00Z");
        Instant end = Instant.parse("2024-01-01T00:05:00Z");
        BatchReport fromDirectory = report("corpus/a.md", "doc-a", start);
        BatchReport explicit = report("extra/b.md", "doc-b", start);
        explicit.setFinishedAt(end);
        when(documentIngestor.ingestDirectory(Path.of("corpus"))).thenReturn(fromDirectory);
        when(documentIngestor.ingest(List.of(Path.of("extra/b.md")))).thenReturn(explicit);

        IngestRequest request = IngestRequest.builder().directory("corpus").paths(List.of("extra/b.md")).build();

        StepVerifier.create(controller.ingest(request))
                .assertNext(response -> {
                    BatchReport merged = response.getBody();
                    assertEquals(2, merged.getSucceededCount());
                    assertEquals(start, merged.getStartedAt());
                    assertEquals(end, merged.getFinishedAt());
                    assertEquals(8, merged.getChunkCount());
                })
                .verifyComplete();
    }

    @Test
    void shouldRejectEmptyRequest() {
        IngestRequest request = IngestRequest.builder().build();

        assertThrows(IllegalArgumentException.class, () -> controller.ingest(request));
        assertThrows(IllegalArgumentException.class, () -> controller.ingest(null));
    }

    private static BatchReport report(String path, String documentId, Instant startedAt) {
        BatchReport report = BatchReport.builder().startedAt(startedAt).finishedAt(startedAt).build();
        report.getSucceeded().add(new BatchReport.IngestedDocument(path, documentId, 4, 3200));
        return report;
    }
}
