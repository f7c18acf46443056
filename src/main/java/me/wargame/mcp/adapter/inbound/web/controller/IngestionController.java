package me.wargame.mcp.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.wargame.mcp.adapter.inbound.web.dto.IngestRequest;
import me.wargame.mcp.domain.model.BatchReport;
import me.wargame.mcp.domain.service.DocumentIngestor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Batch ingestion trigger. The batch runs on a bounded-elastic thread and the
 * response carries the full {@link BatchReport}.
 */
@RestController
@RequestMapping("/api/v1/ingest")
@RequiredArgsConstructor
@Slf4j
public class IngestionController {

    private final DocumentIngestor documentIngestor;

    @PostMapping
    public Mono<ResponseEntity<BatchReport>> ingest(@RequestBody IngestRequest request) {
        if (request == null || (isEmpty(request.getPaths()) && isBlank(request.getDirectory()))) {
            throw new IllegalArgumentException("paths or directory is required");
        }
        return Mono.fromCallable(() -> ResponseEntity.ok(run(request)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    private BatchReport run(IngestRequest request) {
        List<Path> paths = new ArrayList<>();
        if (!isEmpty(request.getPaths())) {
            for (String path : request.getPaths()) {
                paths.add(Path.of(path));
            }
        }
        if (isBlank(request.getDirectory())) {
            return documentIngestor.ingest(paths);
        }
        BatchReport directoryReport = documentIngestor.ingestDirectory(Path.of(request.getDirectory()));
        if (paths.isEmpty()) {
            return directoryReport;
        }
        BatchReport explicit = documentIngestor.ingest(paths);
        log.info("[Ingest] Combined directory and explicit path batches");
        return BatchReport.merge(directoryReport, explicit);
    }

    private static boolean isEmpty(List<String> values) {
        return values == null || values.isEmpty();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
