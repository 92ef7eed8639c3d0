package eu.virtualparadox.flockqa.rag.partition.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Parsed document-list artifact of a partition.
 *
 * @param file               artifact path
 * @param root               whole parsed tree
 * @param envelope           whether the root is an object carrying {@code method}/{@code documents} keys;
 *                           only envelopes can be rewritten in place
 * @param rawMethod          value of the {@code method} key, {@code null} when absent or blank
 * @param rawEmbeddingMethod value of the legacy {@code embedding_method} key, {@code null} when absent or blank
 * @param documents          document list in its persisted shape
 */
public record PartitionArtifact(Path file,
                                JsonNode root,
                                boolean envelope,
                                String rawMethod,
                                String rawEmbeddingMethod,
                                PersistedDocuments documents) {

    /**
     * @return the label the partition is served with: {@code method}, else {@code embedding_method}, else {@code null}
     */
    public String label() {
        return rawMethod != null ? rawMethod : rawEmbeddingMethod;
    }

    /**
     * @return every persisted label, {@code method} first
     */
    public List<String> labels() {
        final List<String> labels = new ArrayList<>(2);
        if (rawMethod != null) {
            labels.add(rawMethod);
        }
        if (rawEmbeddingMethod != null) {
            labels.add(rawEmbeddingMethod);
        }
        return labels;
    }
}
