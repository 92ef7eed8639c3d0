package eu.virtualparadox.flockqa.rag.partition.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One retrievable passage of a partition.
 *
 * @param content  passage text (never null)
 * @param metadata free-form attributes; {@code chunk_type}, {@code table_type}, {@code domain},
 *                 {@code source} and friends drive ranking and answer formatting. Copied on
 *                 construction; nested maps and lists are copied too and none of them can be modified.
 */
public record DocumentRecord(String content, Map<String, Object> metadata) {

    public static final String KEY_SOURCE = "source";
    public static final String KEY_ORIGINAL_FORMAT = "original_format";

    public DocumentRecord {
        content = Objects.requireNonNullElse(content, "");
        metadata = metadata == null
                ? Collections.emptyMap()
                : immutableMap(metadata);
    }

    public static DocumentRecord of(final String content) {
        return new DocumentRecord(content, Map.of());
    }

    /**
     * @return the metadata value for {@code key} rendered as a string, or {@code null} when absent or blank
     */
    public String metadataString(final String key) {
        final Object value = metadata.get(key);
        if (value == null) {
            return null;
        }
        final String s = String.valueOf(value);
        return s.isBlank() ? null : s;
    }

    private static Map<String, Object> immutableMap(final Map<?, ?> source) {
        final Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> copy.put(String.valueOf(key), immutableValue(value)));
        return Collections.unmodifiableMap(copy);
    }

    // null values are kept
    private static Object immutableValue(final Object value) {
        if (value instanceof Map<?, ?> map) {
            return immutableMap(map);
        }
        if (value instanceof Collection<?> collection) {
            final List<Object> copy = new ArrayList<>(collection.size());
            collection.forEach(element -> copy.add(immutableValue(element)));
            return Collections.unmodifiableList(copy);
        }
        return value;
    }
}
