package me.wargame.mcp.adapter.outbound.index;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.wargame.mcp.domain.model.CollectionStats;
import me.wargame.mcp.domain.model.DocumentChunk;
import me.wargame.mcp.domain.model.DocumentCollection;
import me.wargame.mcp.domain.model.DocumentMetadata;
import me.wargame.mcp.domain.model.IndexFilter;
import me.wargame.mcp.domain.model.IndexedChunk;
import me.wargame.mcp.domain.model.ScoredChunk;
import me.wargame.mcp.domain.model.SimilarityMetric;
import me.wargame.mcp.domain.model.exception.IndexUpsertException;
import me.wargame.mcp.infrastructure.config.AutoConfiguration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class LocalVectorIndexAdapterTest {

    private static final String CID = "cid";

    private final ObjectMapper objectMapper = AutoConfiguration.objectMapper();

    @TempDir
    Path tempDir;

    @Test
    void queryRanksByScoreThenChunkIndex() {
        LocalVectorIndexAdapter index = new LocalVectorIndexAdapter(SimilarityMetric.COSINE, null, objectMapper);
        index.replaceDocument("a.txt", "doc-a", List.of(
                chunk("doc-a", 0, DocumentCollection.DOCTRINE, "a.txt", 1, 0),
                chunk("doc-a", 1, DocumentCollection.DOCTRINE, "a.txt", 0, 1),
                chunk("doc-a", 2, DocumentCollection.DOCTRINE, "a.txt", 1, 0)));

        List<ScoredChunk> hits = index.query(new float[] { 1, 0 }, IndexFilter.none(), 10, CID);

        assertEquals(List.of(0, 2, 1), hits.stream().map(hit -> hit.chunk().getChunkIndex()).toList());
        assertEquals(1.0, hits.get(0).score(), 1e-9);
        assertEquals(0.0, hits.get(2).score(), 1e-9);
    }

    @Test
    void queryAppliesFilterAndTopK() {
        LocalVectorIndexAdapter index = new LocalVectorIndexAdapter(SimilarityMetric.COSINE, null, objectMapper);
        index.replaceDocument("a.txt", "doc-a", List.of(
                chunk("doc-a", 0, DocumentCollection.DOCTRINE, "a.txt", 1, 0),
                chunk("doc-a", 1, DocumentCollection.DOCTRINE, "a.txt", 1, 0)));
        index.replaceDocument("b.txt", "doc-b", List.of(
                chunk("doc-b", 0, DocumentCollection.AAR, "b.txt", 1, 0)));

        List<ScoredChunk> aar = index.query(new float[] { 1, 0 },
                new IndexFilter(Set.of(DocumentCollection.AAR)), 10, CID);
        assertEquals(1, aar.size());
        assertEquals("doc-b", aar.get(0).chunk().getDocumentId());

        assertEquals(2, index.query(new float[] { 1, 0 }, null, 2, CID).size());
    }

    @Test
    void replaceSupersedesPreviousVersionOfSameSource() {
        LocalVectorIndexAdapter index = new LocalVectorIndexAdapter(SimilarityMetric.COSINE, null, objectMapper);
        index.replaceDocument("a.txt", "doc-v1", List.of(
                chunk("doc-v1", 0, DocumentCollection.OTHER, "a.txt", 1, 0),
                chunk("doc-v1", 1, DocumentCollection.OTHER, "a.txt", 1, 0)));

        int removed = index.replaceDocument("a.txt", "doc-v2", List.of(
                chunk("doc-v2", 0, DocumentCollection.OTHER, "a.txt", 1, 0)));

        assertEquals(2, removed);
        assertTrue(index.getDocumentChunks("doc-v1").isEmpty());
        assertEquals(1, index.getDocumentChunks("doc-v2").size());
    }

    @Test
    void reingestingSameDocumentReplacesInPlace() {
        LocalVectorIndexAdapter index = new LocalVectorIndexAdapter(SimilarityMetric.COSINE, null, objectMapper);
        List<IndexedChunk> chunks = List.of(
                chunk("doc-a", 0, DocumentCollection.OTHER, "a.txt", 1, 0),
                chunk("doc-a", 1, DocumentCollection.OTHER, "a.txt", 0, 1));

        index.replaceDocument("a.txt", "doc-a", chunks);
        index.replaceDocument("a.txt", "doc-a", chunks);

        assertEquals(2, index.getDocumentChunks("doc-a").size());
        assertEquals(2, index.query(new float[] { 1, 1 }, null, 10, CID).size());
    }

    @Test
    void rejectsChunksOfAnotherDocument() {
        LocalVectorIndexAdapter index = new LocalVectorIndexAdapter(SimilarityMetric.COSINE, null, objectMapper);

        assertThrows(IndexUpsertException.class, () -> index.replaceDocument("a.txt", "doc-a",
                List.of(chunk("doc-b", 0, DocumentCollection.OTHER, "a.txt", 1, 0))));
    }

    @Test
    void documentChunksAreOrderedByIndex() {
        LocalVectorIndexAdapter index = new LocalVectorIndexAdapter(SimilarityMetric.COSINE, null, objectMapper);
        index.replaceDocument("a.txt", "doc-a", List.of(
                chunk("doc-a", 2, DocumentCollection.OTHER, "a.txt", 1, 0),
                chunk("doc-a", 0, DocumentCollection.OTHER, "a.txt", 1, 0),
                chunk("doc-a", 1, DocumentCollection.OTHER, "a.txt", 1, 0)));

        assertEquals(List.of(0, 1, 2), index.getDocumentChunks("doc-a").stream()
                .map(indexed -> indexed.chunk().getChunkIndex()).toList());
        assertTrue(index.getDocumentChunks("unknown").isEmpty());
    }

    @Test
    void deleteRemovesAllChunks() {
        LocalVectorIndexAdapter index = new LocalVectorIndexAdapter(SimilarityMetric.COSINE, null, objectMapper);
        index.replaceDocument("a.txt", "doc-a", List.of(chunk("doc-a", 0, DocumentCollection.OTHER, "a.txt", 1, 0)));

        assertEquals(1, index.deleteDocument("doc-a"));
        assertEquals(0, index.deleteDocument("doc-a"));
        assertTrue(index.query(new float[] { 1, 0 }, null, 10, CID).isEmpty());
    }

    @Test
    void listCollectionsCountsDocumentsAndChunks() {
        LocalVectorIndexAdapter index = new LocalVectorIndexAdapter(SimilarityMetric.COSINE, null, objectMapper);
        index.replaceDocument("a.txt", "doc-a", List.of(
                chunk("doc-a", 0, DocumentCollection.DOCTRINE, "a.txt", 1, 0),
                chunk("doc-a", 1, DocumentCollection.DOCTRINE, "a.txt", 1, 0)));
        index.replaceDocument("b.txt", "doc-b", List.of(
                chunk("doc-b", 0, DocumentCollection.DOCTRINE, "b.txt", 1, 0)));
        index.replaceDocument("c.txt", "doc-c", List.of(
                chunk("doc-c", 0, DocumentCollection.INTEL, "c.txt", 1, 0)));

        List<CollectionStats> stats = index.listCollections();

        assertEquals(List.of(new CollectionStats("doctrine", 2, 3), new CollectionStats("intel", 1, 1)), stats);
    }

    @Test
    void snapshotSurvivesRestart() {
        Path snapshot = tempDir.resolve("index").resolve("snapshot.json");
        LocalVectorIndexAdapter first = new LocalVectorIndexAdapter(SimilarityMetric.COSINE, snapshot, objectMapper);
        first.init();
        first.replaceDocument("a.txt", "doc-a", List.of(
                chunk("doc-a", 0, DocumentCollection.SCENARIO, "a.txt", 1, 0),
                chunk("doc-a", 1, DocumentCollection.SCENARIO, "a.txt", 0, 1)));
        assertTrue(Files.isRegularFile(snapshot));

        LocalVectorIndexAdapter reloaded = new LocalVectorIndexAdapter(SimilarityMetric.COSINE, snapshot,
                objectMapper);
        reloaded.init();

        List<ScoredChunk> hits = reloaded.query(new float[] { 0, 1 }, null, 1, CID);
        assertEquals(1, hits.get(0).chunk().getChunkIndex());
        assertEquals(DocumentCollection.SCENARIO, hits.get(0).chunk().getMetadata().getCollection());
        assertEquals(List.of(new CollectionStats("scenario", 1, 2)), reloaded.listCollections());

        int removed = reloaded.replaceDocument("a.txt", "doc-a2", List.of(
                chunk("doc-a2", 0, DocumentCollection.SCENARIO, "a.txt", 1, 0)));
        assertEquals(2, removed);
    }

    @Test
    void corruptSnapshotFailsStartup() throws Exception {
        Path snapshot = tempDir.resolve("snapshot.json");
        Files.writeString(snapshot, "{broken");
        LocalVectorIndexAdapter index = new LocalVectorIndexAdapter(SimilarityMetric.COSINE, snapshot, objectMapper);

        assertThrows(IllegalStateException.class, index::init);
    }

    @Test
    void failedSnapshotWriteLeavesNewDocumentInvisible() throws Exception {
        Path blocker = Files.writeString(tempDir.resolve("not-a-dir"), "x");
        LocalVectorIndexAdapter index = new LocalVectorIndexAdapter(SimilarityMetric.COSINE,
                blocker.resolve("index.json"), objectMapper);

        assertThrows(IndexUpsertException.class, () -> index.replaceDocument("a.txt", "doc-a", List.of(
                chunk("doc-a", 0, DocumentCollection.OTHER, "a.txt", 1, 0),
                chunk("doc-a", 1, DocumentCollection.OTHER, "a.txt", 1, 0),
                chunk("doc-a", 2, DocumentCollection.OTHER, "a.txt", 1, 0))));

        assertTrue(index.query(new float[] { 1, 0 }, IndexFilter.none(), 10, CID).isEmpty());
        assertTrue(index.getDocumentChunks("doc-a").isEmpty());
        assertTrue(index.listCollections().isEmpty());
    }

    @Test
    void failedSnapshotWriteRestoresPreviousVersion() throws Exception {
        Path dir = tempDir.resolve("store");
        Path snapshot = dir.resolve("index.json");
        LocalVectorIndexAdapter index = new LocalVectorIndexAdapter(SimilarityMetric.COSINE, snapshot, objectMapper);
        index.replaceDocument("a.txt", "doc-v1", List.of(
                chunk("doc-v1", 0, DocumentCollection.OTHER, "a.txt", 1, 0),
                chunk("doc-v1", 1, DocumentCollection.OTHER, "a.txt", 1, 0)));

        Files.delete(snapshot);
        Files.delete(dir);
        Files.writeString(dir, "blocks the snapshot directory");

        assertThrows(IndexUpsertException.class, () -> index.replaceDocument("a.txt", "doc-v2", List.of(
                chunk("doc-v2", 0, DocumentCollection.OTHER, "a.txt", 1, 0))));
        assertThrows(IndexUpsertException.class, () -> index.deleteDocument("doc-v1"));

        assertEquals(2, index.getDocumentChunks("doc-v1").size());
        assertTrue(index.getDocumentChunks("doc-v2").isEmpty());
        assertEquals(2, index.query(new float[] { 1, 0 }, IndexFilter.none(), 10, CID).size());
    }

    @Test
    void replacingWithNoChunksRemovesDocument() {
        LocalVectorIndexAdapter index = new LocalVectorIndexAdapter(SimilarityMetric.COSINE, null, objectMapper);
        index.replaceDocument("a.txt", "doc-a", List.of(
                chunk("doc-a", 0, DocumentCollection.OTHER, "a.txt", 1, 0)));

        int removed = index.replaceDocument("a.txt", "doc-a", List.of());

        assertEquals(1, removed);
        assertTrue(index.getDocumentChunks("doc-a").isEmpty());
        assertTrue(index.listCollections().isEmpty());
    }

    @Test
    void pingChecksSnapshotDirectory() {
        new LocalVectorIndexAdapter(SimilarityMetric.COSINE, null, objectMapper).ping();
        new LocalVectorIndexAdapter(SimilarityMetric.COSINE, tempDir.resolve("snap.json"), objectMapper).ping();

        LocalVectorIndexAdapter missing = new LocalVectorIndexAdapter(SimilarityMetric.COSINE,
                tempDir.resolve("absent").resolve("snap.json"), objectMapper);
        assertThrows(IllegalStateException.class, missing::ping);
    }

    private static IndexedChunk chunk(String documentId, int index, DocumentCollection collection, String source,
            float x, float y) {
        DocumentMetadata metadata = DocumentMetadata.builder()
                .documentId(documentId)
                .sourcePath(source)
                .collection(collection)
                .title("Title " + documentId)
                .tags(new ArrayList<>(List.of("t")))
                .build();
        DocumentChunk chunk = DocumentChunk.builder()
                .chunkId(DocumentChunk.chunkId(documentId, index))
                .documentId(documentId)
                .chunkIndex(index)
                .chunkCount(3)
                .text("chunk " + index)
                .tokenCount(2)
                .metadata(metadata)
                .build();
        return new IndexedChunk(chunk, new float[] { x, y });
    }
}
