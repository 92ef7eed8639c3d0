package eu.virtualparadox.flockqa.rag.embed;

import eu.virtualparadox.flockqa.rag.index.SimilarityIndex;
import eu.virtualparadox.flockqa.rag.partition.model.Partition;
import eu.virtualparadox.flockqa.rag.partition.service.PartitionStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class EmbeddingProviderTest {

    private PartitionStore store;
    private final List<EmbeddingMethod> calls = new ArrayList<>();

    /**
     * Encoder returning {@code {marker}} or failing, and recording every call.
     */
    private QueryEncoder encoder(final EmbeddingMethod method, final boolean available, final float marker) {
        return new QueryEncoder() {
            @Override
            public EmbeddingMethod method() {
                return method;
            }

            @Override
            public boolean isAvailable() {
                return available;
            }

            @Override
            public float[] encode(final String query, final Integer targetDimension) throws EncodingException {
                calls.add(method);
                if (marker < 0) {
                    throw new EncodingException(method.label() + " down");
                }
                return new float[]{marker};
            }
        };
    }

    @BeforeEach
    void setUp() {
        store = mock(PartitionStore.class);
        final Partition broiler = new Partition("broiler", Path.of("broiler"), mock(SimilarityIndex.class),
                List.of(), EmbeddingMethod.LEXICAL_FALLBACK, 5);
        when(store.find("broiler")).thenReturn(Optional.of(broiler));
        when(store.find("global")).thenReturn(Optional.empty());
    }

    @Test
    @DisplayName("Concrete method uses only its encoder")
    void testConcreteMethod() {
        final EmbeddingProvider provider = new EmbeddingProvider(store, List.of(
                encoder(EmbeddingMethod.NEURAL_ENCODER, true, 1f),
                encoder(EmbeddingMethod.REMOTE_API_ENCODER, true, 2f)));

        assertArrayEquals(new float[]{2f}, provider.encode("q", EmbeddingMethod.REMOTE_API_ENCODER, "broiler").orElseThrow());
        assertEquals(List.of(EmbeddingMethod.REMOTE_API_ENCODER), calls);
    }

    @Test
    @DisplayName("Failure of a concrete method does not cascade")
    void testConcreteFailure() {
        final EmbeddingProvider provider = new EmbeddingProvider(store, List.of(
                encoder(EmbeddingMethod.NEURAL_ENCODER, true, -1f),
                new LexicalFallbackEncoder()));

        assertTrue(provider.encode("q", EmbeddingMethod.NEURAL_ENCODER, "broiler").isEmpty());
        assertEquals(List.of(EmbeddingMethod.NEURAL_ENCODER), calls);
    }

    @Test
    @DisplayName("Auto walks neural, remote, lexical and skips unavailable encoders")
    void testCascade() {
        final EmbeddingProvider provider = new EmbeddingProvider(store, List.of(
                new LexicalFallbackEncoder(),
                encoder(EmbeddingMethod.REMOTE_API_ENCODER, false, 2f),
                encoder(EmbeddingMethod.NEURAL_ENCODER, true, -1f)));

        final float[] vector = provider.encode("fcr ross", EmbeddingMethod.AUTO, "broiler").orElseThrow();
        assertEquals(5, vector.length);
        assertEquals(List.of(EmbeddingMethod.NEURAL_ENCODER), calls);
    }

    @Test
    @DisplayName("Null method behaves like auto and stops at the first vector")
    void testNullMethod() {
        final EmbeddingProvider provider = new EmbeddingProvider(store, List.of(
                encoder(EmbeddingMethod.NEURAL_ENCODER, true, -1f),
                encoder(EmbeddingMethod.REMOTE_API_ENCODER, true, 2f),
                new LexicalFallbackEncoder()));

        assertArrayEquals(new float[]{2f}, provider.encode("q", null, "broiler").orElseThrow());
        assertEquals(List.of(EmbeddingMethod.NEURAL_ENCODER, EmbeddingMethod.REMOTE_API_ENCODER), calls);
    }

    @Test
    @DisplayName("Lexical fallback without a loaded partition yields nothing")
    void testLexicalWithoutDimension() {
        final EmbeddingProvider provider = new EmbeddingProvider(store, List.of(new LexicalFallbackEncoder()));
        assertTrue(provider.encode("q", EmbeddingMethod.LEXICAL_FALLBACK, "global").isEmpty());
        assertTrue(provider.encode("q", EmbeddingMethod.AUTO, "global").isEmpty());
    }

    @Test
    @DisplayName("Unexpected runtime errors are contained")
    void testRuntimeError() {
        final QueryEncoder exploding = new QueryEncoder() {
            @Override
            public EmbeddingMethod method() {
                return EmbeddingMethod.NEURAL_ENCODER;
            }

            @Override
            public boolean isAvailable() {
                return true;
            }

            @Override
            public float[] encode(final String query, final Integer targetDimension) {
                throw new IllegalStateException("native crash");
            }
        };
        final EmbeddingProvider provider = new EmbeddingProvider(store, List.of(exploding));
        assertTrue(provider.encode("q", EmbeddingMethod.NEURAL_ENCODER, "broiler").isEmpty());
    }
}
