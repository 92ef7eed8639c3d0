package eu.virtualparadox.flockqa.rag.embed;

/**
 * Turns a query string into a dense vector with one specific {@link EmbeddingMethod}.
 */
public interface QueryEncoder {

    /**
     * @return the method this encoder implements; never {@link EmbeddingMethod#AUTO}
     */
    EmbeddingMethod method();

    /**
     * Cheap check, no model loading and no network call.
     *
     * @return false when the encoder is known to be unusable (missing credential, failed model load)
     */
    boolean isAvailable();

    /**
     * Embeds a single query.
     *
     * @param query           query text, non-null
     * @param targetDimension dimension of the partition the vector will be searched against,
     *                        {@code null} when unknown
     * @return the query vector
     * @throws EncodingException if the encoder cannot produce a vector
     */
    float[] encode(String query, Integer targetDimension) throws EncodingException;
}
