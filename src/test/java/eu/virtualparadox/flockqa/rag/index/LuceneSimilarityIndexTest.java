package eu.virtualparadox.flockqa.rag.index;

import eu.virtualparadox.flockqa.rag.retriever.model.SearchHits;
import org.apache.lucene.index.VectorSimilarityFunction;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import static eu.virtualparadox.flockqa.testsupport.PartitionFixtures.axis;
import static eu.virtualparadox.flockqa.testsupport.PartitionFixtures.writeIndex;
import static org.junit.jupiter.api.Assertions.*;

class LuceneSimilarityIndexTest {

    @TempDir
    Path tmp;

    private LuceneSimilarityIndex index(final VectorSimilarityFunction similarity) throws IOException {
        writeIndex(tmp, List.of(axis(0, 4), axis(1, 4), axis(2, 4)), similarity);
        return LuceneSimilarityIndex.open(tmp.resolve("index"));
    }

    @Test
    @DisplayName("Euclidean scores come back as squared distances with ordinals")
    void testEuclidean() throws IOException {
        try (LuceneSimilarityIndex index = index(VectorSimilarityFunction.EUCLIDEAN)) {
            assertEquals(3, index.size());
            assertEquals(4, index.dimension());

            final SearchHits hits = index.search(axis(1, 4), 3);
            assertEquals(3, hits.size());
            assertEquals(1, hits.indices()[0]);
            assertEquals(0.0, hits.distances()[0], 1e-4);
            assertEquals(2.0, hits.distances()[1], 1e-4);
            assertEquals(2.0, hits.distances()[2], 1e-4);
        }
    }

    @Test
    @DisplayName("Cosine scores map to the same squared distances for unit vectors")
    void testCosine() throws IOException {
        try (LuceneSimilarityIndex index = index(VectorSimilarityFunction.COSINE)) {
            final SearchHits hits = index.search(axis(2, 4), 2);
            assertEquals(2, hits.size());
            assertEquals(2, hits.indices()[0]);
            assertEquals(0.0, hits.distances()[0], 1e-4);
            assertEquals(2.0, hits.distances()[1], 1e-4);
        }
    }

    @Test
    @DisplayName("k larger than the index is capped, k of zero yields nothing")
    void testBounds() throws IOException {
        try (LuceneSimilarityIndex index = index(VectorSimilarityFunction.EUCLIDEAN)) {
            assertEquals(3, index.search(axis(0, 4), 50).size());
            assertEquals(0, index.search(axis(0, 4), 0).size());
        }
    }

    @Test
    @DisplayName("Wrong query dimension is rejected")
    void testDimensionMismatch() throws IOException {
        try (LuceneSimilarityIndex index = index(VectorSimilarityFunction.EUCLIDEAN)) {
            assertThrows(IllegalArgumentException.class, () -> index.search(new float[]{1f, 0f}, 1));
        }
    }

    @Test
    @DisplayName("Empty index has no dimension")
    void testEmpty() throws IOException {
        writeIndex(tmp, List.of(), VectorSimilarityFunction.EUCLIDEAN);
        try (LuceneSimilarityIndex index = LuceneSimilarityIndex.open(tmp.resolve("index"))) {
            assertEquals(0, index.size());
            assertNull(index.dimension());
            assertEquals(0, index.search(axis(0, 4), 3).size());
        }
    }
}
