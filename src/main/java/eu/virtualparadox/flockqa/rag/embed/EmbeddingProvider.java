package eu.virtualparadox.flockqa.rag.embed;

import eu.virtualparadox.flockqa.rag.partition.model.Partition;
import eu.virtualparadox.flockqa.rag.partition.service.PartitionStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Single entry point for query encoding.
 * <p>
 * A concrete method uses exactly that encoder. {@link EmbeddingMethod#AUTO} (or {@code null})
 * walks the cascade neural, remote (only with a credential), lexical and returns the first vector
 * produced. Encoder failures never propagate: they are logged and yield an empty result.
 */
@Service
@Slf4j
public class EmbeddingProvider {

    static final List<EmbeddingMethod> CASCADE = List.of(
            EmbeddingMethod.NEURAL_ENCODER,
            EmbeddingMethod.REMOTE_API_ENCODER,
            EmbeddingMethod.LEXICAL_FALLBACK);

    private final PartitionStore partitionStore;
    private final Map<EmbeddingMethod, QueryEncoder> encoders = new EnumMap<>(EmbeddingMethod.class);

    public EmbeddingProvider(final PartitionStore partitionStore, final List<QueryEncoder> encoders) {
        this.partitionStore = partitionStore;
        for (final QueryEncoder encoder : encoders) {
            this.encoders.put(encoder.method(), encoder);
        }
    }

    /**
     * @param query       query text
     * @param method      method of the target partition, or {@code AUTO}/{@code null} for the cascade
     * @param partitionId partition the vector is meant for; supplies the dimension for the lexical fallback
     * @return the query vector, or empty when no encoder produced one
     */
    public Optional<float[]> encode(final String query, final EmbeddingMethod method, final String partitionId) {
        Objects.requireNonNull(query, "query");
        final Integer dimension = partitionStore.find(partitionId)
                .map(Partition::dimensionality)
                .orElse(null);

        if (method == null || method == EmbeddingMethod.AUTO) {
            for (final EmbeddingMethod candidate : CASCADE) {
                final QueryEncoder encoder = encoders.get(candidate);
                if (encoder == null || !encoder.isAvailable()) {
                    log.debug("Skipping {} encoder, not available", candidate.label());
                    continue;
                }
                final Optional<float[]> vector = tryEncode(encoder, query, dimension);
                if (vector.isPresent()) {
                    return vector;
                }
            }
            log.error("All embedding methods failed for partition {}", partitionId);
            return Optional.empty();
        }

        final QueryEncoder encoder = encoders.get(method);
        if (encoder == null) {
            log.warn("No encoder registered for {}", method.label());
            return Optional.empty();
        }
        return tryEncode(encoder, query, dimension);
    }

    private static Optional<float[]> tryEncode(final QueryEncoder encoder, final String query, final Integer dimension) {
        try {
            return Optional.ofNullable(encoder.encode(query, dimension));
        } catch (EncodingException e) {
            log.warn("{} embedding failed: {}", encoder.method().label(), e.getMessage());
            return Optional.empty();
        } catch (Exception e) {
            log.error("{} embedding failed unexpectedly", encoder.method().label(), e);
            return Optional.empty();
        }
    }
}
