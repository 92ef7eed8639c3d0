package eu.virtualparadox.flockqa.rag.partition.model;

import eu.virtualparadox.flockqa.rag.embed.EmbeddingMethod;

import java.nio.file.Path;

/**
 * Diagnostic view of one partition. Fields other than {@code id} and {@code loaded}
 * are {@code null}/zero for partitions that are not resident.
 */
public record PartitionStatus(String id,
                              boolean loaded,
                              Path location,
                              int vectors,
                              int documents,
                              EmbeddingMethod embeddingMethod,
                              Integer dimensionality) {

    public static PartitionStatus of(final Partition partition) {
        return new PartitionStatus(
                partition.id(),
                true,
                partition.location(),
                partition.index().size(),
                partition.documents().size(),
                partition.embeddingMethod(),
                partition.dimensionality());
    }

    public static PartitionStatus notLoaded(final String id) {
        return new PartitionStatus(id, false, null, 0, 0, null, null);
    }
}
