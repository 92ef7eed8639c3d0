package eu.virtualparadox.flockqa.rag.partition.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The document list of a partition artifact as it was found on disk, before normalization.
 */
public sealed interface PersistedDocuments {

    /**
     * @return short name of the detected shape, recorded on every normalized record
     */
    String shape();

    /** A list whose entries are (mostly) objects; non-object entries are tolerated. */
    record RecordList(List<JsonNode> entries) implements PersistedDocuments {
        @Override
        public String shape() {
            return "record_list";
        }
    }

    /** A list made only of plain strings. */
    record StringList(List<String> entries) implements PersistedDocuments {
        @Override
        public String shape() {
            return "string_list";
        }
    }

    /** An object keyed by document id whose values are objects or strings. */
    record IdMap(Map<String, JsonNode> entries) implements PersistedDocuments {
        @Override
        public String shape() {
            return "id_map";
        }
    }

    /** Anything else: a scalar, null or a missing node. */
    record Unknown(JsonNode raw) implements PersistedDocuments {
        @Override
        public String shape() {
            return "unknown";
        }
    }

    /**
     * Classifies a JSON node into one of the four shapes. Never fails.
     *
     * @param node document-list node, may be null
     * @return the tagged shape
     */
    static PersistedDocuments classify(final JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return new Unknown(node == null ? MissingNode.getInstance() : node);
        }
        if (node.isArray()) {
            boolean allText = node.size() > 0;
            final List<JsonNode> entries = new ArrayList<>(node.size());
            for (final JsonNode entry : node) {
                entries.add(entry);
                allText &= entry.isTextual();
            }
            if (allText) {
                final List<String> strings = new ArrayList<>(entries.size());
                for (final JsonNode entry : entries) {
                    strings.add(entry.asText());
                }
                return new StringList(strings);
            }
            return new RecordList(entries);
        }
        if (node.isObject()) {
            final Map<String, JsonNode> entries = new LinkedHashMap<>();
            final Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                final Map.Entry<String, JsonNode> field = fields.next();
                entries.put(field.getKey(), field.getValue());
            }
            return new IdMap(entries);
        }
        return new Unknown(node);
    }
}
