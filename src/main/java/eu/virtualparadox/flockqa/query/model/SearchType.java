package eu.virtualparadox.flockqa.query.model;

/**
 * How a retrieval result was obtained.
 */
public enum SearchType {

    VECTOR("vector"),
    VECTOR_FILTERED("vector_filtered"),
    VECTOR_FALLBACK("vector_fallback"),
    VECTOR_FALLBACK_FILTERED("vector_fallback_filtered");

    private final String value;

    SearchType(final String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static SearchType of(final boolean fallback, final boolean filtered) {
        if (fallback) {
            return filtered ? VECTOR_FALLBACK_FILTERED : VECTOR_FALLBACK;
        }
        return filtered ? VECTOR_FILTERED : VECTOR;
    }
}
