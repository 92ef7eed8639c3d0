package eu.virtualparadox.flockqa.rag.embed;

import org.springframework.stereotype.Service;

import java.util.Locale;

/**
 * Offline last resort: a low-information vector derived from word hashes, sized to the target
 * partition. Word {@code i} sets component {@code i} to {@code 0.1 + (hash mod 100) / 1000};
 * words beyond the dimension are ignored and the remaining components stay zero.
 * Deterministic across runs since {@link String#hashCode()} is specified.
 */
@Service
public class LexicalFallbackEncoder implements QueryEncoder {

    @Override
    public EmbeddingMethod method() {
        return EmbeddingMethod.LEXICAL_FALLBACK;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public float[] encode(final String query, final Integer targetDimension) throws EncodingException {
        if (targetDimension == null || targetDimension <= 0) {
            throw new EncodingException("Lexical fallback needs the partition dimension");
        }

        final float[] vector = new float[targetDimension];
        final String trimmed = query.trim().toLowerCase(Locale.ROOT);
        if (trimmed.isEmpty()) {
            return vector;
        }

        final String[] words = trimmed.split("\\s+");
        for (int i = 0; i < words.length && i < targetDimension; i++) {
            vector[i] = 0.1f + Math.floorMod(words[i].hashCode(), 100) / 1000.0f;
        }
        return vector;
    }
}
