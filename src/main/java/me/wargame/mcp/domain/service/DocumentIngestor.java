package me.wargame.mcp.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.wargame.mcp.domain.chunking.ChunkSegmenter;
import me.wargame.mcp.domain.chunking.TextSegment;
import me.wargame.mcp.domain.model.BatchReport;
import me.wargame.mcp.domain.model.DocumentChunk;
import me.wargame.mcp.domain.model.DocumentMetadata;
import me.wargame.mcp.domain.model.ExtractedDocument;
import me.wargame.mcp.domain.model.IndexedChunk;
import me.wargame.mcp.domain.model.IngestionStage;
import me.wargame.mcp.domain.model.MetadataWarning;
import me.wargame.mcp.domain.model.ResolvedMetadata;
import me.wargame.mcp.domain.model.exception.EmbeddingException;
import me.wargame.mcp.domain.model.exception.IndexUpsertException;
import me.wargame.mcp.domain.model.exception.IngestionException;
import me.wargame.mcp.infrastructure.config.WargameProperties;
import me.wargame.mcp.port.outbound.EmbeddingPort;
import me.wargame.mcp.port.outbound.VectorIndexPort;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Runs documents through extract, segment, metadata, embed and index.
 *
 * <p>
 * Documents are processed on a bounded worker pool. A failure in one document
 * is recorded in the {@link BatchReport} with the stage it failed at and never
 * stops the rest of the batch. Each document ends with one atomic
 * {@link VectorIndexPort#replaceDocument} call, so re-ingesting a source
 * replaces its chunks instead of adding to them.
 */
@Service
@Slf4j
public class DocumentIngestor {

    static final String NO_INDEXABLE_TEXT = "no indexable text";

    private final TextExtractionService extractionService;
    private final ChunkSegmenter segmenter;
    private final MetadataResolver metadataResolver;
    private final EmbeddingPort embeddingPort;
    private final VectorIndexPort indexPort;
    private final Clock clock;
    private final int embeddingBatchSize;
    private final Set<String> supportedExtensions;
    private final ExecutorService workers;

    public DocumentIngestor(TextExtractionService extractionService, ChunkSegmenter segmenter,
            MetadataResolver metadataResolver, EmbeddingPort embeddingPort, VectorIndexPort indexPort,
            WargameProperties properties, Clock clock) {
        this.extractionService = extractionService;
        this.segmenter = segmenter;
        this.metadataResolver = metadataResolver;
        this.embeddingPort = embeddingPort;
        this.indexPort = indexPort;
        this.clock = clock;
        this.embeddingBatchSize = properties.getIngestion().getEmbeddingBatchSize();
        this.supportedExtensions = properties.getIngestion().getSupportedExtensions().stream()
                .map(ext -> ext.toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
        AtomicInteger threadNumber = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(properties.getIngestion().getWorkers(), r -> {
            Thread t = new Thread(r, "ingest-worker-" + threadNumber.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Ingests every supported file under {@code directory}, in path order.
     */
    public BatchReport ingestDirectory(Path directory) {
        if (!Files.isDirectory(directory)) {
            throw new IllegalArgumentException("Not a directory: " + directory);
        }
        List<Path> files;
        try (Stream<Path> walk = Files.walk(directory)) {
            files = walk.filter(Files::isRegularFile)
                    .filter(path -> !metadataResolver.isSidecar(path))
                    .filter(this::isSupported)
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot walk " + directory, e);
        }
        log.info("[Ingest] Found {} supported files under {}", files.size(), directory);
        return ingest(files);
    }

    /**
     * Ingests the given files. The report lists documents in input order.
     */
    public BatchReport ingest(List<Path> paths) {
        BatchReport report = BatchReport.builder().startedAt(clock.instant()).build();

        List<Future<DocumentOutcome>> futures = new ArrayList<>(paths.size());
        for (Path path : paths) {
            futures.add(workers.submit(() -> ingestDocument(path)));
        }

        for (int i = 0; i < paths.size(); i++) {
            Path path = paths.get(i);
            DocumentOutcome outcome;
            try {
                outcome = futures.get(i).get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                futures.subList(i, futures.size()).forEach(future -> future.cancel(true));
                throw new IllegalStateException("Ingestion interrupted", e);
            } catch (ExecutionException e) {
                // ingestDocument converts failures itself; this is an Error escaping the worker
                outcome = DocumentOutcome.failure(path, IngestionStage.EXTRACT, String.valueOf(e.getCause()),
                        List.of());
            }
            outcome.warnings().forEach(report.getWarnings()::add);
            if (outcome.succeeded() != null) {
                report.getSucceeded().add(outcome.succeeded());
            } else {
                report.getFailed().add(outcome.failed());
            }
        }

        report.setFinishedAt(clock.instant());
        log.info("[Ingest] Batch done: {} succeeded, {} failed, {} chunks, {} tokens",
                report.getSucceededCount(), report.getFailedCount(), report.getChunkCount(),
                report.getTokenCount());
        return report;
    }

    private boolean isSupported(Path path) {
        return TextExtractionService.extensionOf(path)
                .map(ext -> supportedExtensions.contains(ext) && extractionService.supports(path))
                .orElse(false);
    }

    DocumentOutcome ingestDocument(Path path) {
        IngestionStage stage = IngestionStage.EXTRACT;
        List<BatchReport.DocumentWarning> warnings = new ArrayList<>();
        try {
            ExtractedDocument extracted = extractionService.extract(path);

            stage = IngestionStage.SEGMENT;
            List<TextSegment> segments = segmenter.split(extracted.getText());
            if (segments.isEmpty()) {
                log.warn("[Ingest] {} has no indexable text", path);
                stage = IngestionStage.METADATA;
                DocumentMetadata metadata = metadataResolver.resolve(path, extracted).metadata();
                stage = IngestionStage.INDEX;
                int retired = upsert(metadata, List.of());
                if (retired > 0) {
                    log.info("[Ingest] {} emptied, removed {} stale chunks", path, retired);
                }
                return DocumentOutcome.failure(path, IngestionStage.SEGMENT, NO_INDEXABLE_TEXT, warnings);
            }

            stage = IngestionStage.METADATA;
            ResolvedMetadata resolved = metadataResolver.resolve(path, extracted);
            for (MetadataWarning warning : resolved.warnings()) {
                warnings.add(new BatchReport.DocumentWarning(path.toString(), warning.field(), warning.message()));
            }
            DocumentMetadata metadata = resolved.metadata();
            List<DocumentChunk> chunks = toChunks(segments, metadata, extracted.isOcr());

            stage = IngestionStage.EMBED;
            List<float[]> vectors = embed(chunks);

            stage = IngestionStage.INDEX;
            List<IndexedChunk> indexed = new ArrayList<>(chunks.size());
            for (int i = 0; i < chunks.size(); i++) {
                indexed.add(new IndexedChunk(chunks.get(i), vectors.get(i)));
            }
            int superseded = upsert(metadata, indexed);

            long tokens = segments.stream().mapToLong(TextSegment::tokenCount).sum();
            log.debug("[Ingest] {} -> {} ({} chunks, {} superseded)", path, metadata.getDocumentId(),
                    chunks.size(), superseded);
            return DocumentOutcome.success(new BatchReport.IngestedDocument(path.toString(),
                    metadata.getDocumentId(), chunks.size(), tokens), warnings);
        } catch (IngestionException e) {
            log.warn("[Ingest] {} failed at {}: {}", path, e.getStage(), e.getMessage());
            return DocumentOutcome.failure(path, e.getStage(), e.getMessage(), warnings);
        } catch (RuntimeException e) {
            log.warn("[Ingest] {} failed at {} unexpectedly", path, stage, e);
            return DocumentOutcome.failure(path, stage, e.getClass().getSimpleName() + ": " + e.getMessage(),
                    warnings);
        }
    }

    private List<DocumentChunk> toChunks(List<TextSegment> segments, DocumentMetadata metadata, boolean ocr) {
        List<DocumentChunk> chunks = new ArrayList<>(segments.size());
        for (int i = 0; i < segments.size(); i++) {
            TextSegment segment = segments.get(i);
            chunks.add(DocumentChunk.builder()
                    .chunkId(DocumentChunk.chunkId(metadata.getDocumentId(), i))
                    .documentId(metadata.getDocumentId())
                    .chunkIndex(i)
                    .chunkCount(segments.size())
                    .text(segment.text())
                    .ocr(ocr)
                    .tokenCount(segment.tokenCount())
                    .metadata(metadata)
                    .build());
        }
        return chunks;
    }

    /**
     * Embeds chunk texts in batches issued concurrently, preserving order.
     */
    private List<float[]> embed(List<DocumentChunk> chunks) {
        List<CompletableFuture<List<float[]>>> batches = new ArrayList<>();
        for (int from = 0; from < chunks.size(); from += embeddingBatchSize) {
            List<String> texts = chunks.subList(from, Math.min(from + embeddingBatchSize, chunks.size()))
                    .stream()
                    .map(DocumentChunk::getText)
                    .toList();
            batches.add(embeddingPort.embedBatch(texts));
        }
        List<float[]> vectors = new ArrayList<>(chunks.size());
        try {
            for (CompletableFuture<List<float[]>> batch : batches) {
                vectors.addAll(batch.join());
            }
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new EmbeddingException("Embedding failed: " + cause.getMessage(), cause);
        }
        if (vectors.size() != chunks.size()) {
            throw new EmbeddingException(
                    "Embedding returned " + vectors.size() + " vectors for " + chunks.size() + " chunks");
        }
        return vectors;
    }

    private int upsert(DocumentMetadata metadata, List<IndexedChunk> indexed) {
        try {
            return indexPort.replaceDocument(metadata.getSourcePath(), metadata.getDocumentId(), indexed);
        } catch (IndexUpsertException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new IndexUpsertException("Index upsert failed: " + e.getMessage(), e);
        }
    }

    @PreDestroy
    public void shutdown() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("[Ingest] Workers shut down");
    }

    record DocumentOutcome(BatchReport.IngestedDocument succeeded, BatchReport.FailedDocument failed,
            List<BatchReport.DocumentWarning> warnings) {

        static DocumentOutcome success(BatchReport.IngestedDocument document,
                List<BatchReport.DocumentWarning> warnings) {
            return new DocumentOutcome(document, null, warnings);
        }

        static DocumentOutcome failure(Path path, IngestionStage stage, String reason,
                List<BatchReport.DocumentWarning> warnings) {
            return new DocumentOutcome(null, new BatchReport.FailedDocument(path.toString(), stage, reason),
                    warnings);
        }
    }
}
