package eu.virtualparadox.flockqa.rag.embed;

/**
 * A loaded sentence-embedding model.
 */
public interface SentenceModel extends AutoCloseable {

    /**
     * @param text text to embed
     * @return the pooled, unit-length sentence vector
     * @throws EncodingException if inference fails
     */
    float[] embed(String text) throws EncodingException;

    @Override
    void close() throws Exception;
}
