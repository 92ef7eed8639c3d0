package eu.virtualparadox.flockqa.rag.embed;

/**
 * Strategies used to turn text into comparable vectors.
 * <p>
 * {@link #AUTO} is a request-side marker only: it asks the provider to walk the fallback
 * cascade and is never attached to a loaded partition.
 */
public enum EmbeddingMethod {

    NEURAL_ENCODER("SentenceTransformers", true),
    REMOTE_API_ENCODER("OpenAI", true),
    LEXICAL_FALLBACK("TF-IDF", false),
    AUTO("auto", false);

    private final String label;
    private final boolean unitNormalized;

    EmbeddingMethod(final String label, final boolean unitNormalized) {
        this.label = label;
        this.unitNormalized = unitNormalized;
    }

    /**
     * @return the canonical label persisted in partition artifacts
     */
    public String label() {
        return label;
    }

    /**
     * @return whether query vectors must be L2-normalized before searching partitions built with this method
     */
    public boolean unitNormalized() {
        return unitNormalized;
    }
}
