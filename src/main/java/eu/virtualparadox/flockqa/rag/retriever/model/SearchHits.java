package eu.virtualparadox.flockqa.rag.retriever.model;

/**
 * Nearest neighbours of one query, best first.
 *
 * @param distances squared L2 distances, lower is closer
 * @param indices   document-list positions; {@code -1} marks a vector without a resolvable record
 */
public record SearchHits(float[] distances, int[] indices) {

    public SearchHits {
        if (distances.length != indices.length) {
            throw new IllegalArgumentException("distances.length != indices.length");
        }
    }

    public static SearchHits empty() {
        return new SearchHits(new float[0], new int[0]);
    }

    public int size() {
        return indices.length;
    }
}
