package eu.virtualparadox.flockqa.rag.partition.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import eu.virtualparadox.flockqa.rag.partition.model.DocumentRecord;
import eu.virtualparadox.flockqa.rag.partition.model.PersistedDocuments;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static eu.virtualparadox.flockqa.rag.partition.model.DocumentRecord.KEY_ORIGINAL_FORMAT;
import static eu.virtualparadox.flockqa.rag.partition.model.DocumentRecord.KEY_SOURCE;

/**
 * Converts any {@link PersistedDocuments} shape into the canonical {@link DocumentRecord} list.
 * <p>
 * The conversion is total: every record gets a {@code source} (synthetic {@code doc_<i>} or the
 * map key when none is persisted), an {@code original_format} tag and a {@code document_shape}
 * tag. Any unexpected failure yields a single placeholder record carrying the error.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class DocumentNormalizer {

    public static final String KEY_DOCUMENT_SHAPE = "document_shape";
    public static final String KEY_ERROR = "error";
    public static final String ERROR_CONTENT = "Document list could not be loaded";

    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {};

    /** Minimum length for a string field to be taken as content of an unlabelled object. */
    private static final int MIN_GUESSED_CONTENT = 10;

    private final ObjectMapper objectMapper;

    /**
     * @param documents document list in its persisted shape
     * @return canonical records in persisted order; never null, never throws
     */
    public List<DocumentRecord> normalize(final PersistedDocuments documents) {
        final String shape = documents == null ? "unknown" : documents.shape();
        try {
            final List<DocumentRecord> normalized = convert(documents);
            log.info("Documents normalized: {} records from {} shape", normalized.size(), shape);
            return normalized;
        } catch (RuntimeException e) {
            log.error("Document normalization failed for {} shape", shape, e);
            final Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put(KEY_SOURCE, "error_fallback");
            metadata.put(KEY_ERROR, String.valueOf(e.getMessage()));
            metadata.put(KEY_DOCUMENT_SHAPE, shape);
            return List.of(new DocumentRecord(ERROR_CONTENT, metadata));
        }
    }

    private List<DocumentRecord> convert(final PersistedDocuments documents) {
        final List<DocumentRecord> out = new ArrayList<>();

        if (documents instanceof PersistedDocuments.RecordList recordList) {
            final List<JsonNode> entries = recordList.entries();
            for (int i = 0; i < entries.size(); i++) {
                out.add(fromEntry(entries.get(i), syntheticId(i), "dict_conversion", "", documents.shape()));
            }
        } else if (documents instanceof PersistedDocuments.StringList stringList) {
            final List<String> entries = stringList.entries();
            for (int i = 0; i < entries.size(); i++) {
                out.add(plain(entries.get(i), syntheticId(i), "string", documents.shape()));
            }
        } else if (documents instanceof PersistedDocuments.IdMap idMap) {
            for (final Map.Entry<String, JsonNode> entry : idMap.entries().entrySet()) {
                out.add(fromEntry(entry.getValue(), entry.getKey(), "dict_value", "dict_", documents.shape()));
            }
        } else {
            final JsonNode raw = documents == null ? null : ((PersistedDocuments.Unknown) documents).raw();
            log.warn("Unknown document list format: {}", raw == null ? "null" : raw.getNodeType());
            out.add(plain(render(raw), "unknown_format", typeName(raw), "unknown"));
        }
        return out;
    }

    /**
     * Converts one list element or map value.
     *
     * @param node            the persisted entry
     * @param defaultSource   source used when the entry has none
     * @param unlabelledTag   format tag for objects with neither {@code content} nor {@code text}
     * @param scalarTagPrefix prefix for the format tag of non-object entries
     * @param shape           detected list shape
     */
    private DocumentRecord fromEntry(final JsonNode node,
                                     final String defaultSource,
                                     final String unlabelledTag,
                                     final String scalarTagPrefix,
                                     final String shape) {
        if (node != null && node.isObject()) {
            if (node.has("content")) {
                return labelled(node, node.get("content"), defaultSource, "record", shape);
            }
            if (node.has("text")) {
                return labelled(node, node.get("text"), defaultSource, "text_record", shape);
            }
            final Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put(KEY_SOURCE, defaultSource);
            metadata.put(KEY_ORIGINAL_FORMAT, unlabelledTag);
            metadata.put(KEY_DOCUMENT_SHAPE, shape);
            return new DocumentRecord(guessContent(node), metadata);
        }
        if (node != null && node.isTextual()) {
            return plain(node.asText(), defaultSource, scalarTagPrefix + "string", shape);
        }
        return plain(render(node), defaultSource, scalarTagPrefix + typeName(node), shape);
    }

    private DocumentRecord labelled(final JsonNode node,
                                    final JsonNode contentNode,
                                    final String defaultSource,
                                    final String format,
                                    final String shape) {
        final Map<String, Object> metadata = new LinkedHashMap<>();
        final JsonNode metadataNode = node.get("metadata");
        if (metadataNode != null && metadataNode.isObject()) {
            metadata.putAll(objectMapper.convertValue(metadataNode, METADATA_TYPE));
        }

        final JsonNode sourceNode = node.get(KEY_SOURCE);
        if (sourceNode != null && !sourceNode.isNull() && !sourceNode.asText().isBlank()) {
            metadata.putIfAbsent(KEY_SOURCE, sourceNode.asText());
        }
        metadata.putIfAbsent(KEY_SOURCE, defaultSource);
        metadata.putIfAbsent(KEY_ORIGINAL_FORMAT, format);
        metadata.put(KEY_DOCUMENT_SHAPE, shape);

        return new DocumentRecord(render(contentNode), metadata);
    }

    private DocumentRecord plain(final String content, final String source, final String format, final String shape) {
        final Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(KEY_SOURCE, source);
        metadata.put(KEY_ORIGINAL_FORMAT, format);
        metadata.put(KEY_DOCUMENT_SHAPE, shape);
        return new DocumentRecord(content, metadata);
    }

    private String guessContent(final JsonNode node) {
        final Iterator<JsonNode> values = node.elements();
        while (values.hasNext()) {
            final JsonNode value = values.next();
            if (value.isTextual() && value.asText().length() > MIN_GUESSED_CONTENT) {
                return value.asText();
            }
        }
        return node.toString();
    }

    private static String render(final JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return "";
        }
        return node.isValueNode() ? node.asText() : node.toString();
    }

    private static String typeName(final JsonNode node) {
        return node == null ? "missing" : node.getNodeType().name().toLowerCase(Locale.ROOT);
    }

    private static String syntheticId(final int index) {
        return "doc_" + index;
    }
}
