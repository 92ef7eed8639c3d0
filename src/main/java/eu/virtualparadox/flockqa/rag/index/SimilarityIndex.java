package eu.virtualparadox.flockqa.rag.index;

import eu.virtualparadox.flockqa.rag.retriever.model.SearchHits;

import java.io.Closeable;
import java.io.IOException;

/**
 * Read-only k-nearest-neighbour index over one partition's vectors.
 * <p>
 * Every vector carries the ordinal of the document record it was built from, so that hits
 * map back onto the partition's document list.
 */
public interface SimilarityIndex extends Closeable {

    /**
     * @return number of indexed vectors
     */
    int size();

    /**
     * @return the dimension shared by all vectors, or {@code null} when the index is empty
     */
    Integer dimension();

    /**
     * Runs a single-query kNN search.
     *
     * @param query query vector; its length must equal {@link #dimension()}
     * @param k     maximum number of neighbours
     * @return hits ordered by increasing distance (never null)
     * @throws IOException              if the underlying index cannot be read
     * @throws IllegalArgumentException if the query dimension does not match
     */
    SearchHits search(float[] query, int k) throws IOException;
}
