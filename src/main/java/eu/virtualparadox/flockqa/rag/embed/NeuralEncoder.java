package eu.virtualparadox.flockqa.rag.embed;

import eu.virtualparadox.flockqa.application.config.ApplicationConfig;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.concurrent.Callable;

/**
 * Local sentence encoder. The model is shared process-wide and loaded on first use, exactly once;
 * concurrent first callers wait for the single load. A failed load is remembered and the encoder
 * reports itself unavailable from then on.
 */
@Service
@Slf4j
public class NeuralEncoder implements QueryEncoder {

    private final Callable<SentenceModel> loader;
    private final Object initLock = new Object();

    private volatile SentenceModel model;
    private volatile boolean loadFailed;

    @Autowired
    public NeuralEncoder(final ApplicationConfig config) {
        this(() -> OnnxSentenceModel.load(config.getEmbedding().getNeural()));
    }

    NeuralEncoder(final Callable<SentenceModel> loader) {
        this.loader = loader;
    }

    @Override
    public EmbeddingMethod method() {
        return EmbeddingMethod.NEURAL_ENCODER;
    }

    @Override
    public boolean isAvailable() {
        return !loadFailed;
    }

    @Override
    public float[] encode(final String query, final Integer targetDimension) throws EncodingException {
        final float[] vector = model().embed(query);
        log.debug("Neural embedding of dimension {}", vector.length);
        return vector;
    }

    private SentenceModel model() throws EncodingException {
        SentenceModel current = model;
        if (current != null) {
            return current;
        }
        synchronized (initLock) {
            if (model != null) {
                return model;
            }
            if (loadFailed) {
                throw new EncodingException("Sentence encoder failed to load earlier");
            }
            try {
                model = loader.call();
                return model;
            } catch (Exception e) {
                loadFailed = true;
                throw new EncodingException("Sentence encoder could not be loaded", e);
            }
        }
    }

    @PreDestroy
    public void cleanup() throws Exception {
        if (model != null) {
            model.close();
        }
    }
}
