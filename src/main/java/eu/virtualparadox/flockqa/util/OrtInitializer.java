package eu.virtualparadox.flockqa.util;

import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtSession;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class OrtInitializer {

    private OrtInitializer() {
        // Prevent instantiation
    }

    /**
     * Builds session options for the sentence encoder.
     *
     * @param intraOpThreads requested intra-op threads; {@code <= 0} leaves one core free
     * @return configured options
     * @throws OrtException if the runtime rejects the settings
     */
    public static OrtSession.SessionOptions initializeOrt(final int intraOpThreads) throws OrtException {
        final OrtSession.SessionOptions opts = new OrtSession.SessionOptions();

        final int threads = intraOpThreads > 0
                ? intraOpThreads
                : Math.max(1, Runtime.getRuntime().availableProcessors() - 1);

        opts.setIntraOpNumThreads(threads);
        opts.setInterOpNumThreads(1);

        log.info("Intra-op threads: {}, Inter-op threads: {}", threads, 1);
        return opts;
    }
}
