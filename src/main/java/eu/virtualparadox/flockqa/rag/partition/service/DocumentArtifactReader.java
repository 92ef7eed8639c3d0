package eu.virtualparadox.flockqa.rag.partition.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import eu.virtualparadox.flockqa.rag.partition.model.PartitionArtifact;
import eu.virtualparadox.flockqa.rag.partition.model.PersistedDocuments;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Reads a partition's JSON document-list artifact.
 * <p>
 * Accepted layouts:
 * <pre>
 *   { "method": "...", "embedding_method": "...", "documents": &lt;any shape&gt; }   envelope
 *   [ ... ]                                                                  bare list
 *   { "id-1": ..., "id-2": ... }                                             bare id map
 *   anything else                                                            unknown
 * </pre>
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class DocumentArtifactReader {

    public static final String KEY_METHOD = "method";
    public static final String KEY_EMBEDDING_METHOD = "embedding_method";
    public static final String KEY_DOCUMENTS = "documents";

    private final ObjectMapper objectMapper;

    /**
     * @param file artifact path
     * @return the parsed artifact
     * @throws PartitionLoadException if the file cannot be read or is not valid JSON
     */
    public PartitionArtifact read(final Path file) {
        final JsonNode root;
        try {
            root = objectMapper.readTree(file.toFile());
        } catch (IOException e) {
            throw new PartitionLoadException("Unreadable document artifact " + file, e);
        }

        if (isEnvelope(root)) {
            log.debug("Envelope artifact {} with keys {}", file, root.size());
            return new PartitionArtifact(file, root, true, text(root, KEY_METHOD), text(root, KEY_EMBEDDING_METHOD),
                    PersistedDocuments.classify(root.get(KEY_DOCUMENTS)));
        }

        log.info("Bare document artifact {} ({})", file, root == null ? "empty" : root.getNodeType());
        return new PartitionArtifact(file, root, false, null, null, PersistedDocuments.classify(root));
    }

    private static boolean isEnvelope(final JsonNode root) {
        return root != null && root.isObject()
                && (root.has(KEY_DOCUMENTS) || root.has(KEY_METHOD) || root.has(KEY_EMBEDDING_METHOD));
    }

    private static String text(final JsonNode root, final String key) {
        final JsonNode value = root.get(key);
        if (value != null && value.isTextual() && !value.asText().isBlank()) {
            return value.asText();
        }
        return null;
    }
}
