package eu.virtualparadox.flockqa.rag.embed;

import eu.virtualparadox.flockqa.application.config.ApplicationConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class NeuralEncoderTest {

    private static SentenceModel fixedModel(final float[] vector) {
        return new SentenceModel() {
            @Override
            public float[] embed(final String text) {
                return vector.clone();
            }

            @Override
            public void close() {
            }
        };
    }

    @Test
    @DisplayName("Model is loaded once even under concurrent first use")
    void testSingleLoad() throws Exception {
        final AtomicInteger loads = new AtomicInteger();
        final NeuralEncoder encoder = new NeuralEncoder(() -> {
            loads.incrementAndGet();
            Thread.sleep(50);
            return fixedModel(new float[]{0.6f, 0.8f});
        });

        final int threads = 8;
        final ExecutorService pool = Executors.newFixedThreadPool(threads);
        final CountDownLatch start = new CountDownLatch(1);
        try {
            final List<Future<float[]>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return encoder.encode("ross 308", null);
                }));
            }
            start.countDown();
            for (final Future<float[]> f : futures) {
                assertArrayEquals(new float[]{0.6f, 0.8f}, f.get(5, TimeUnit.SECONDS));
            }
        } finally {
            pool.shutdownNow();
        }
        assertEquals(1, loads.get());
    }

    @Test
    @DisplayName("A failed load is remembered and not retried")
    void testFailedLoad() {
        final AtomicInteger loads = new AtomicInteger();
        final Callable<SentenceModel> failing = () -> {
            loads.incrementAndGet();
            throw new IOException("model.onnx missing");
        };
        final NeuralEncoder encoder = new NeuralEncoder(failing);

        assertTrue(encoder.isAvailable());
        assertThrows(EncodingException.class, () -> encoder.encode("q", null));
        assertFalse(encoder.isAvailable());
        assertThrows(EncodingException.class, () -> encoder.encode("q", null));
        assertEquals(1, loads.get());
    }

    @Test
    @DisplayName("Missing model directory surfaces as an encoding failure")
    void testMissingModelDirectory(@TempDir final Path tmp) {
        final ApplicationConfig config = new ApplicationConfig();
        config.getEmbedding().getNeural().setModelDir(tmp.resolve("absent"));
        final NeuralEncoder encoder = new NeuralEncoder(config);

        final EncodingException e = assertThrows(EncodingException.class, () -> encoder.encode("q", null));
        assertInstanceOf(IOException.class, e.getCause());
    }
}
