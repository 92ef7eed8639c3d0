package eu.virtualparadox.flockqa.rag.retriever.service;

import eu.virtualparadox.flockqa.rag.partition.service.PartitionStore;
import eu.virtualparadox.flockqa.rag.retriever.model.SearchHits;
import org.apache.lucene.index.VectorSimilarityFunction;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import static eu.virtualparadox.flockqa.testsupport.PartitionFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class VectorSearcherTest {

    @TempDir
    Path root;

    private PartitionStore store;
    private VectorSearcher searcher;

    @BeforeEach
    void setUp() throws IOException {
        for (final String[] p : new String[][]{{"broiler", "SentenceTransformers"}, {"layer", "TF-IDF"}}) {
            final Path dir = root.resolve(p[0]);
            writeIndex(dir, List.of(axis(0, 4), axis(1, 4)), VectorSimilarityFunction.EUCLIDEAN);
            writeDocuments(dir, envelope(p[1], List.of("first", "second")));
        }
        store = store(config(root));
        assertTrue(store.ensureLoaded("broiler"));
        assertTrue(store.ensureLoaded("layer"));
        searcher = new VectorSearcher(store);
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    @Test
    @DisplayName("Neural partitions search with a unit-length copy of the query")
    void testNormalized() {
        final float[] query = {2f, 0f, 0f, 0f};
        final SearchHits hits = searcher.search("broiler", query, 2).orElseThrow();

        assertEquals(0, hits.indices()[0]);
        assertEquals(0.0, hits.distances()[0], 1e-4);
        assertArrayEquals(new float[]{2f, 0f, 0f, 0f}, query);
    }

    @Test
    @DisplayName("Lexical partitions search with the raw query")
    void testLexicalNotNormalized() {
        final SearchHits hits = searcher.search("layer", new float[]{2f, 0f, 0f, 0f}, 2).orElseThrow();

        assertEquals(0, hits.indices()[0]);
        assertEquals(1.0, hits.distances()[0], 1e-4);
    }

    @Test
    @DisplayName("Dimension mismatch and unloaded partitions yield nothing")
    void testFailures() {
        assertTrue(searcher.search("broiler", new float[]{1f, 0f}, 2).isEmpty());
        assertTrue(searcher.search("global", axis(0, 4), 2).isEmpty());
    }
}
