package me.wargame.mcp.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.wargame.mcp.adapter.outbound.embedding.DeterministicEmbeddingAdapter;
import me.wargame.mcp.adapter.outbound.extraction.PdfTextExtractor;
import me.wargame.mcp.adapter.outbound.extraction.PlainTextExtractor;
import me.wargame.mcp.adapter.outbound.index.LocalVectorIndexAdapter;
import me.wargame.mcp.domain.chunking.ChunkSegmenter;
import me.wargame.mcp.domain.chunking.RegexTokenizer;
import me.wargame.mcp.domain.model.BatchReport;
import me.wargame.mcp.domain.model.CollectionStats;
import me.wargame.mcp.domain.model.IngestionStage;
import me.wargame.mcp.domain.model.SimilarityMetric;
import me.wargame.mcp.infrastructure.config.WargameProperties;
import me.wargame.mcp.port.outbound.EmbeddingPort;
import me.wargame.mcp.port.outbound.VectorIndexPort;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class DocumentIngestorTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @TempDir
    Path corpus;

    private WargameProperties properties;
    private TextExtractionService extractionService;
    private ChunkSegmenter segmenter;
    private MetadataResolver metadataResolver;
    private LocalVectorIndexAdapter index;
    private DocumentIngestor ingestor;
    private Clock clock;

    @BeforeEach
    void setUp() {
        properties = new WargameProperties();
        properties.getIngestion().setWorkers(2);
        properties.getIngestion().setEmbeddingBatchSize(2);
        extractionService = new TextExtractionService(List.of(new PlainTextExtractor(), new PdfTextExtractor()));
        segmenter = new ChunkSegmenter(RegexTokenizer.words(), 20, 5);
        metadataResolver = new MetadataResolver(properties);
        index = new LocalVectorIndexAdapter(SimilarityMetric.COSINE, null, new ObjectMapper());
        clock = Clock.fixed(NOW, ZoneOffset.UTC);
        ingestor = newIngestor(new DeterministicEmbeddingAdapter(64), index);
    }

    @AfterEach
    void tearDown() {
        ingestor.shutdown();
    }

    private DocumentIngestor newIngestor(EmbeddingPort embeddingPort, VectorIndexPort indexPort) {
        return new DocumentIngestor(extractionService, segmenter, metadataResolver, embeddingPort, indexPort,
                properties, clock);
    }

    private Path write(String relative, String content) throws IOException {
        Path path = corpus.resolve(relative);
        Files.createDirectories(path.getParent());
        Files.writeString(path, content);
        return path;
    }

    private static String words(String prefix, int count) {
        return IntStream.range(0, count).mapToObj(i -> prefix + i).collect(Collectors.joining(" "));
    }

    private long totalChunks() {
        return index.listCollections().stream().mapToLong(CollectionStats::chunkCount).sum();
    }

    @Test
    void shouldIsolateCorruptDocumentFromRestOfBatch() throws IOException {
        Path first = write("doctrine/defense.txt", words("defense", 50));
        Path broken = write("aar/broken.pdf", "this is not a pdf");
        Path second = write("aar/exercise.md", words("exercise", 30));

        BatchReport report = ingestor.ingest(List.of(first, broken, second));

        assertEquals(2, report.getSucceededCount());
        assertEquals(1, report.getFailedCount());
        assertEquals(first.toString(), report.getSucceeded().get(0).path());
        assertEquals(second.toString(), report.getSucceeded().get(1).path());
        BatchReport.FailedDocument failed = report.getFailed().get(0);
        assertEquals(broken.toString(), failed.path());
        assertEquals(IngestionStage.EXTRACT, failed.stage());
        assertEquals(NOW, report.getStartedAt());
        assertEquals(NOW, report.getFinishedAt());
        assertEquals(report.getChunkCount(), totalChunks());
    }

    @Test
    void shouldReplaceChunksWhenSameFileIsIngestedTwice() throws IOException {
        Path doc = write("scenario/baltic.txt", words("baltic", 60));

        BatchReport first = ingestor.ingest(List.of(doc));
        long chunksAfterFirst = totalChunks();
        BatchReport second = ingestor.ingest(List.of(doc));

        assertEquals(first.getSucceeded().get(0).documentId(), second.getSucceeded().get(0).documentId());
        assertEquals(chunksAfterFirst, totalChunks());
        assertEquals(first.getChunkCount(), index.getDocumentChunks(first.getSucceeded().get(0).documentId())
                .size());
    }

    @Test
    void shouldDropPreviousVersionWhenEditedFileIsReingested() throws IOException {
        Path doc = write("intel/estimate.txt", words("estimate", 40));
        String oldId = ingestor.ingest(List.of(doc)).getSucceeded().get(0).documentId();

        Files.writeString(doc, words("revised", 25));
        BatchReport report = ingestor.ingest(List.of(doc));
        String newId = report.getSucceeded().get(0).documentId();

        assertNotEquals(oldId, newId);
        assertTrue(index.getDocumentChunks(oldId).isEmpty());
        assertEquals(report.getChunkCount(), totalChunks());
    }

    @Test
    void shouldReportEmptyDocumentAsSegmentFailure() throws IOException {
        Path empty = write("aar/empty.txt", "   \n\n  ");

        BatchReport report = ingestor.ingest(List.of(empty));

        assertEquals(0, report.getSucceededCount());
        assertEquals(IngestionStage.SEGMENT, report.getFailed().get(0).stage());
        assertEquals(DocumentIngestor.NO_INDEXABLE_TEXT, report.getFailed().get(0).reason());
    }

    @Test
    void shouldRemoveStaleChunksWhenFileIsEmptied() throws IOException {
        Path doc = write("aar/shrinking.txt", words("aar", 60));
        BatchReport first = ingestor.ingest(List.of(doc));
        assertTrue(first.getChunkCount() > 1);
        assertEquals(first.getChunkCount(), totalChunks());

        Files.writeString(doc, "  \n\n   \n");
        BatchReport second = ingestor.ingest(List.of(doc));

        assertEquals(1, second.getFailedCount());
        assertEquals(IngestionStage.SEGMENT, second.getFailed().get(0).stage());
        assertEquals(0, totalChunks());
    }

    @Test
    void shouldLeaveNothingIndexedWhenSnapshotCannotBeWritten() throws IOException {
        Path blocker = write("blocker", "regular file");
        LocalVectorIndexAdapter persistent = new LocalVectorIndexAdapter(SimilarityMetric.COSINE,
                blocker.resolve("index.json"), new ObjectMapper());
        DocumentIngestor persistentIngestor = newIngestor(new DeterministicEmbeddingAdapter(64), persistent);
        Path doc = write("doctrine/fm.txt", words("fm", 50));

        BatchReport report = persistentIngestor.ingest(List.of(doc));
        persistentIngestor.shutdown();

        assertEquals(1, report.getFailedCount());
        assertEquals(IngestionStage.INDEX, report.getFailed().get(0).stage());
        assertTrue(persistent.listCollections().isEmpty());
    }

    @Test
    void shouldReportEmbeddingFailureStage() throws IOException {
        EmbeddingPort failing = mock(EmbeddingPort.class);
        when(failing.embedBatch(anyList()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("provider down")));
        DocumentIngestor failingIngestor = newIngestor(failing, index);
        Path doc = write("doctrine/fm.txt", words("fm", 10));

        BatchReport report = failingIngestor.ingest(List.of(doc));
        failingIngestor.shutdown();

        assertEquals(IngestionStage.EMBED, report.getFailed().get(0).stage());
        assertTrue(report.getFailed().get(0).reason().contains("provider down"));
        assertEquals(0, totalChunks());
    }

    @Test
    void shouldReportIndexFailureStage() throws IOException {
        VectorIndexPort failingIndex = mock(VectorIndexPort.class);
        when(failingIndex.replaceDocument(anyString(), anyString(), any()))
                .thenThrow(new IllegalStateException("disk full"));
        DocumentIngestor failingIngestor = newIngestor(new DeterministicEmbeddingAdapter(64), failingIndex);
        Path doc = write("doctrine/fm.txt", words("fm", 10));

        BatchReport report = failingIngestor.ingest(List.of(doc));
        failingIngestor.shutdown();

        assertEquals(IngestionStage.INDEX, report.getFailed().get(0).stage());
        assertTrue(report.getFailed().get(0).reason().contains("disk full"));
    }

    @Test
    void shouldCarryMetadataWarningsIntoReport() throws IOException {
        Path doc = write("misc/notes.txt", words("note", 10));
        Files.writeString(metadataResolver.sidecarFor(doc), "year: 1200\n");

        BatchReport report = ingestor.ingest(List.of(doc));

        assertEquals(1, report.getSucceededCount());
        assertEquals(1, report.getWarnings().size());
        assertEquals("year", report.getWarnings().get(0).field());
    }

    @Test
    void shouldWalkDirectorySkippingSidecarsAndUnsupportedFiles() throws IOException {
        Path doc = write("doctrine/fm.txt", words("fm", 10));
        Files.writeString(metadataResolver.sidecarFor(doc), "title: Field Manual\n");
        write("doctrine/image.png", "binary");

        BatchReport report = ingestor.ingestDirectory(corpus);

        assertEquals(1, report.getSucceededCount());
        assertEquals(0, report.getFailedCount());
        assertEquals(doc.toString(), report.getSucceeded().get(0).path());
    }

    @Test
    void shouldRejectMissingDirectory() {
        Path missing = corpus.resolve("missing");

        assertThrows(IllegalArgumentException.class, () -> ingestor.ingestDirectory(missing));
    }
}
