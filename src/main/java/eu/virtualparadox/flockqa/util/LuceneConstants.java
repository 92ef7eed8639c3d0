package eu.virtualparadox.flockqa.util;

/**
 * Field layout of a partition's similarity index.
 */
public class LuceneConstants {
    /** Dense query-comparable vector, HNSW indexed. */
    public static final String FIELD_VECTOR = "vector";
    /** Position of the matching record in the partition's document list. */
    public static final String FIELD_ORDINAL = "ordinal";

    private LuceneConstants() {
        // prevent instantiation
    }
}
