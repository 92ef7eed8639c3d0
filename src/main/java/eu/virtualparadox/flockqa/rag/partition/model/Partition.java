package eu.virtualparadox.flockqa.rag.partition.model;

import eu.virtualparadox.flockqa.rag.embed.EmbeddingMethod;
import eu.virtualparadox.flockqa.rag.index.SimilarityIndex;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Immutable snapshot of a loaded knowledge partition.
 * <p>
 * {@code documents.get(i)} is the record behind the vector whose ordinal is {@code i}
 * in {@code index}.
 *
 * @param id              partition identifier ({@code broiler}, {@code layer}, {@code global}, ...)
 * @param location        directory the partition was read from
 * @param index           similarity index handle
 * @param documents       canonical document list
 * @param embeddingMethod method the partition's vectors were built with
 * @param dimensionality  vector dimension, {@code null} when the index holds no vectors
 */
public record Partition(String id,
                        Path location,
                        SimilarityIndex index,
                        List<DocumentRecord> documents,
                        EmbeddingMethod embeddingMethod,
                        Integer dimensionality) {

    public Partition {
        documents = List.copyOf(documents);
    }

    public Optional<Integer> dimension() {
        return Optional.ofNullable(dimensionality);
    }
}
