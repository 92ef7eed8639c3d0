package eu.virtualparadox.flockqa.rag.rerank.service;

import eu.virtualparadox.flockqa.rag.partition.model.DocumentRecord;

import java.util.regex.Pattern;

/**
 * Heuristic detection of tabular or structured passages.
 * <p>
 * A record counts as structured when its metadata says so ({@code chunk_type=table} or any
 * {@code table_type}) or when its text shows one of:
 * <ul>
 *   <li>three or more pipes</li>
 *   <li>five or more commas over several lines</li>
 *   <li>three whitespace-aligned columns</li>
 *   <li>a header word followed by a number (age 21, fcr 1.6)</li>
 *   <li>a numeric range with a time unit (14-21 days)</li>
 *   <li>a labelled nutrient value (lysine: 1.2)</li>
 * </ul>
 */
public final class StructuredContentDetector {

    public static final String KEY_CHUNK_TYPE = "chunk_type";
    public static final String KEY_TABLE_TYPE = "table_type";
    public static final String CHUNK_TYPE_TABLE = "table";

    private static final int MIN_PIPES = 3;
    private static final int MIN_COMMAS = 5;

    private static final Pattern FIXED_WIDTH_COLUMNS = Pattern.compile("\\S+\\s{2,}\\S+\\s{2,}\\S+");
    private static final Pattern HEADER_WITH_NUMBER = Pattern.compile(
            "(?:age|week|day|poids|weight|fcr|protein)\\s+\\d+",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    private static final Pattern RANGE_WITH_TIME_UNIT = Pattern.compile(
            "\\d+\\s*[-–]\\s*\\d+\\s*(?:days?|jours?|weeks?|sem)",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    private static final Pattern LABELLED_VALUE = Pattern.compile(
            "(?:lysine|protein|energy|calcium)\\s*[:\\-]\\s*\\d+",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

    private StructuredContentDetector() {
        // prevent instantiation
    }

    public static boolean looksLikeTable(final DocumentRecord document) {
        return isTabularMetadata(document) || looksLikeTable(document.content());
    }

    /**
     * @return true when metadata marks the record as a table chunk or carries a table type
     */
    public static boolean isTabularMetadata(final DocumentRecord document) {
        return CHUNK_TYPE_TABLE.equals(document.metadataString(KEY_CHUNK_TYPE))
                || document.metadataString(KEY_TABLE_TYPE) != null;
    }

    public static boolean isTableChunk(final DocumentRecord document) {
        return CHUNK_TYPE_TABLE.equals(document.metadataString(KEY_CHUNK_TYPE));
    }

    /**
     * Text-only part of the heuristic.
     */
    public static boolean looksLikeTable(final String text) {
        if (text == null || text.isEmpty()) {
            return false;
        }
        return count(text, '|') >= MIN_PIPES
                || (count(text, ',') >= MIN_COMMAS && text.indexOf('\n') >= 0)
                || FIXED_WIDTH_COLUMNS.matcher(text).find()
                || HEADER_WITH_NUMBER.matcher(text).find()
                || RANGE_WITH_TIME_UNIT.matcher(text).find()
                || LABELLED_VALUE.matcher(text).find();
    }

    private static int count(final String text, final char c) {
        int n = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == c) {
                n++;
            }
        }
        return n;
    }
}
