package eu.virtualparadox.flockqa.rag.embed;

import ai.djl.huggingface.tokenizers.Encoding;
import ai.djl.huggingface.tokenizers.HuggingFaceTokenizer;
import ai.onnxruntime.OnnxTensor;
import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtSession;
import eu.virtualparadox.flockqa.application.config.ApplicationConfig;
import eu.virtualparadox.flockqa.util.OrtInitializer;
import eu.virtualparadox.flockqa.util.VectorMath;
import lombok.extern.slf4j.Slf4j;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

/**
 * Sentence encoder running an exported transformer (e.g. all-MiniLM-L6-v2) through ONNX Runtime.
 * <p>
 * Expects {@code model.onnx} and {@code tokenizer.json} in the configured model directory.
 * The sentence vector is the attention-masked mean of the last hidden state, scaled to unit length.
 */
@Slf4j
public final class OnnxSentenceModel implements SentenceModel {

    static final String MODEL_FILE = "model.onnx";
    static final String TOKENIZER_FILE = "tokenizer.json";

    private final OrtEnvironment env;
    private final OrtSession session;
    private final HuggingFaceTokenizer tokenizer;
    private final int maxTokens;

    private OnnxSentenceModel(final OrtEnvironment env,
                              final OrtSession session,
                              final HuggingFaceTokenizer tokenizer,
                              final int maxTokens) {
        this.env = env;
        this.session = session;
        this.tokenizer = tokenizer;
        this.maxTokens = maxTokens;
    }

    /**
     * Loads model and tokenizer from {@code neural.modelDir}.
     *
     * @throws IOException  if a model file is missing or unreadable
     * @throws OrtException if ONNX Runtime rejects the model
     */
    public static OnnxSentenceModel load(final ApplicationConfig.Neural neural) throws IOException, OrtException {
        final Path modelPath = neural.getModelDir().resolve(MODEL_FILE);
        final Path tokenizerPath = neural.getModelDir().resolve(TOKENIZER_FILE);
        if (!Files.isRegularFile(modelPath) || !Files.isRegularFile(tokenizerPath)) {
            throw new FileNotFoundException("Sentence encoder files missing in " + neural.getModelDir());
        }

        final OrtEnvironment env = OrtEnvironment.getEnvironment();
        final OrtSession session = env.createSession(modelPath.toString(), OrtInitializer.initializeOrt(neural.getIntraOpThreads()));
        final HuggingFaceTokenizer tokenizer = HuggingFaceTokenizer.newInstance(tokenizerPath);

        log.info("Loaded ONNX sentence encoder: {}", modelPath);
        log.info("Model expects inputs: {}", session.getInputNames());
        return new OnnxSentenceModel(env, session, tokenizer, neural.getMaxTokens());
    }

    @Override
    public float[] embed(final String text) throws EncodingException {
        final Encoding encoding = tokenizer.encode(text);
        final int len = Math.min(encoding.getIds().length, maxTokens);

        final long[][] inputIdArr = new long[1][len];
        final long[][] attnMaskArr = new long[1][len];
        final long[][] tokenTypeArr = new long[1][len];
        System.arraycopy(encoding.getIds(), 0, inputIdArr[0], 0, len);
        System.arraycopy(encoding.getAttentionMask(), 0, attnMaskArr[0], 0, len);

        try (final OnnxTensor inputIds = OnnxTensor.createTensor(env, inputIdArr);
             final OnnxTensor attentionMask = OnnxTensor.createTensor(env, attnMaskArr);
             final OnnxTensor tokenTypes = OnnxTensor.createTensor(env, tokenTypeArr)) {

            final Map<String, OnnxTensor> inputs = new HashMap<>();
            if (session.getInputNames().contains("input_ids")) {
                inputs.put("input_ids", inputIds);
            }
            if (session.getInputNames().contains("attention_mask")) {
                inputs.put("attention_mask", attentionMask);
            }
            if (session.getInputNames().contains("token_type_ids")) {
                inputs.put("token_type_ids", tokenTypes);
            }

            try (final OrtSession.Result result = session.run(inputs)) {
                final float[][][] hidden = (float[][][]) result.get(0).getValue();
                return VectorMath.normalizeInPlace(meanPool(hidden[0], attnMaskArr[0]));
            }
        } catch (OrtException e) {
            throw new EncodingException("Sentence encoder inference failed", e);
        }
    }

    private static float[] meanPool(final float[][] tokenVectors, final long[] attentionMask) {
        final int hiddenDim = tokenVectors[0].length;
        final float[] pooled = new float[hiddenDim];

        int validCount = 0;
        for (int i = 0; i < tokenVectors.length; i++) {
            if (attentionMask[i] == 1) {
                final float[] tokenVec = tokenVectors[i];
                for (int j = 0; j < hiddenDim; j++) {
                    pooled[j] += tokenVec[j];
                }
                validCount++;
            }
        }

        if (validCount > 0) {
            for (int j = 0; j < hiddenDim; j++) {
                pooled[j] /= validCount;
            }
        }
        return pooled;
    }

    @Override
    public void close() throws OrtException {
        tokenizer.close();
        session.close();
    }
}
