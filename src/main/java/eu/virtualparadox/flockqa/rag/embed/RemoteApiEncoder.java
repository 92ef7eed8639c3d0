package eu.virtualparadox.flockqa.rag.embed;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Hosted embedding API. The model bean only exists when a credential is configured,
 * see {@code RemoteEmbeddingConfig}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RemoteApiEncoder implements QueryEncoder {

    private final Optional<EmbeddingModel> embeddingModel;

    @Override
    public EmbeddingMethod method() {
        return EmbeddingMethod.REMOTE_API_ENCODER;
    }

    @Override
    public boolean isAvailable() {
        return embeddingModel.isPresent();
    }

    @Override
    public float[] encode(final String query, final Integer targetDimension) throws EncodingException {
        final EmbeddingModel model = embeddingModel
                .orElseThrow(() -> new EncodingException("Remote embedding credential not configured"));
        try {
            final float[] vector = model.embed(query);
            if (vector == null || vector.length == 0) {
                throw new EncodingException("Remote embedding service returned no vector");
            }
            log.debug("Remote embedding of dimension {}", vector.length);
            return vector;
        } catch (RuntimeException e) {
            throw new EncodingException("Remote embedding call failed", e);
        }
    }
}
