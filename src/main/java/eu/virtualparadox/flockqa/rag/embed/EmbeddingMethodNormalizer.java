package eu.virtualparadox.flockqa.rag.embed;

import lombok.extern.slf4j.Slf4j;

import java.util.Locale;
import java.util.Map;

import static java.util.Map.entry;

/**
 * Canonicalizes persisted embedding labels (spelling variants, vendor and model names)
 * into one of the three concrete {@link EmbeddingMethod}s.
 */
@Slf4j
public final class EmbeddingMethodNormalizer {

    private static final Map<String, EmbeddingMethod> ALIASES = Map.ofEntries(
            // local sentence encoders
            entry("sentencetransformers", EmbeddingMethod.NEURAL_ENCODER),
            entry("sentence_transformers", EmbeddingMethod.NEURAL_ENCODER),
            entry("sentence-transformers", EmbeddingMethod.NEURAL_ENCODER),
            entry("sentence transformers", EmbeddingMethod.NEURAL_ENCODER),
            entry("all-minilm-l6-v2", EmbeddingMethod.NEURAL_ENCODER),
            entry("huggingface", EmbeddingMethod.NEURAL_ENCODER),
            entry("transformer", EmbeddingMethod.NEURAL_ENCODER),
            entry("bert", EmbeddingMethod.NEURAL_ENCODER),
            entry("fastembed", EmbeddingMethod.NEURAL_ENCODER),
            entry("fast-embed", EmbeddingMethod.NEURAL_ENCODER),
            entry("onnx", EmbeddingMethod.NEURAL_ENCODER),
            entry("bge-small-en-v1.5", EmbeddingMethod.NEURAL_ENCODER),
            entry("neural_encoder", EmbeddingMethod.NEURAL_ENCODER),
            // remote API
            entry("openai", EmbeddingMethod.REMOTE_API_ENCODER),
            entry("openaiembeddings", EmbeddingMethod.REMOTE_API_ENCODER),
            entry("openai_embeddings", EmbeddingMethod.REMOTE_API_ENCODER),
            entry("text-embedding-ada-002", EmbeddingMethod.REMOTE_API_ENCODER),
            entry("ada-002", EmbeddingMethod.REMOTE_API_ENCODER),
            entry("text-embedding-3-small", EmbeddingMethod.REMOTE_API_ENCODER),
            entry("text-embedding-3-large", EmbeddingMethod.REMOTE_API_ENCODER),
            entry("remote_api_encoder", EmbeddingMethod.REMOTE_API_ENCODER),
            // lexical
            entry("tf-idf", EmbeddingMethod.LEXICAL_FALLBACK),
            entry("tfidf", EmbeddingMethod.LEXICAL_FALLBACK),
            entry("tf_idf", EmbeddingMethod.LEXICAL_FALLBACK),
            entry("lexical", EmbeddingMethod.LEXICAL_FALLBACK),
            entry("lexical_fallback", EmbeddingMethod.LEXICAL_FALLBACK)
    );

    private EmbeddingMethodNormalizer() {
        // prevent instantiation
    }

    /**
     * Maps a persisted label to its method. Blank and unknown labels resolve to
     * {@link EmbeddingMethod#NEURAL_ENCODER}; unknown ones are logged.
     *
     * @param rawLabel label as found in the artifact, may be null
     * @return a concrete method, never {@link EmbeddingMethod#AUTO}
     */
    public static EmbeddingMethod canonicalize(final String rawLabel) {
        if (rawLabel == null || rawLabel.isBlank()) {
            return EmbeddingMethod.NEURAL_ENCODER;
        }
        final EmbeddingMethod method = ALIASES.get(rawLabel.trim().toLowerCase(Locale.ROOT));
        if (method == null) {
            log.warn("Unknown embedding method '{}', assuming {}", rawLabel, EmbeddingMethod.NEURAL_ENCODER.label());
            return EmbeddingMethod.NEURAL_ENCODER;
        }
        return method;
    }

    /**
     * @return true when {@code rawLabel} is already the canonical spelling of its method
     */
    public static boolean isCanonical(final String rawLabel) {
        return rawLabel != null && canonicalize(rawLabel).label().equals(rawLabel);
    }
}
