package eu.virtualparadox.flockqa.rag.retriever.service;

import eu.virtualparadox.flockqa.rag.partition.model.Partition;
import eu.virtualparadox.flockqa.rag.partition.service.PartitionStore;
import eu.virtualparadox.flockqa.rag.retriever.model.SearchHits;
import eu.virtualparadox.flockqa.util.VectorMath;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Nearest-neighbour search over one loaded partition.
 * <p>
 * Steps:
 * <ol>
 *   <li>Check the query length against the partition dimension</li>
 *   <li>L2-normalize a copy of the query, unless the partition uses the lexical fallback</li>
 *   <li>Run the kNN query and return distances with document ordinals</li>
 * </ol>
 * Every failure is logged and reported as an empty result.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class VectorSearcher {

    private final PartitionStore partitionStore;

    /**
     * @param partitionId loaded partition to search
     * @param queryVector query vector, left untouched
     * @param k           number of neighbours requested
     * @return distances and ordinals, or empty when the search could not run
     */
    public Optional<SearchHits> search(final String partitionId, final float[] queryVector, final int k) {
        try {
            final Optional<Partition> found = partitionStore.find(partitionId);
            if (found.isEmpty()) {
                log.warn("Search on partition {} which is not loaded", partitionId);
                return Optional.empty();
            }
            final Partition partition = found.get();

            if (!dimensionMatches(partition, queryVector)) {
                log.error("Query dimension {} incompatible with partition {} (dimension {})",
                        queryVector.length, partition.id(), partition.dimensionality());
                return Optional.empty();
            }

            final float[] query = partition.embeddingMethod().unitNormalized()
                    ? VectorMath.normalized(queryVector)
                    : queryVector;

            final SearchHits hits = partition.index().search(query, k);
            log.debug("Partition {}: {} hits for k={}", partition.id(), hits.size(), k);
            return Optional.of(hits);
        } catch (Exception e) {
            log.error("Vector search failed on partition {}", partitionId, e);
            return Optional.empty();
        }
    }

    private static boolean dimensionMatches(final Partition partition, final float[] queryVector) {
        return partition.dimension()
                .map(d -> d == queryVector.length)
                .orElse(true);
    }
}
