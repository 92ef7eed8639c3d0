package eu.virtualparadox.flockqa.rag.embed;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.ai.embedding.EmbeddingModel;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class RemoteApiEncoderTest {

    @Test
    @DisplayName("Without a configured model the encoder is unavailable")
    void testNoCredential() {
        final RemoteApiEncoder encoder = new RemoteApiEncoder(Optional.empty());
        assertFalse(encoder.isAvailable());
        assertThrows(EncodingException.class, () -> encoder.encode("fcr", 3));
    }

    @Test
    @DisplayName("Vector comes from the embedding model")
    void testEmbed() throws EncodingException {
        final EmbeddingModel model = mock(EmbeddingModel.class);
        when(model.embed("fcr")).thenReturn(new float[]{0.1f, 0.2f, 0.3f});

        final RemoteApiEncoder encoder = new RemoteApiEncoder(Optional.of(model));
        assertTrue(encoder.isAvailable());
        assertArrayEquals(new float[]{0.1f, 0.2f, 0.3f}, encoder.encode("fcr", 3));
    }

    @Test
    @DisplayName("Service failures and empty answers become encoding failures")
    void testFailures() {
        final EmbeddingModel failing = mock(EmbeddingModel.class);
        when(failing.embed("fcr")).thenThrow(new IllegalStateException("401 Unauthorized"));
        assertThrows(EncodingException.class, () -> new RemoteApiEncoder(Optional.of(failing)).encode("fcr", 3));

        final EmbeddingModel empty = mock(EmbeddingModel.class);
        when(empty.embed("fcr")).thenReturn(new float[0]);
        assertThrows(EncodingException.class, () -> new RemoteApiEncoder(Optional.of(empty)).encode("fcr", 3));
    }
}
