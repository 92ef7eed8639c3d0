package eu.virtualparadox.flockqa.query;

import eu.virtualparadox.flockqa.application.config.ApplicationConfig;
import eu.virtualparadox.flockqa.query.model.QueryContext;
import eu.virtualparadox.flockqa.query.model.RetrievalResult;
import eu.virtualparadox.flockqa.query.model.SearchType;
import eu.virtualparadox.flockqa.rag.answer.AnswerSynthesizer;
import eu.virtualparadox.flockqa.rag.classify.service.DomainClassifier;
import eu.virtualparadox.flockqa.rag.embed.EmbeddingMethod;
import eu.virtualparadox.flockqa.rag.embed.EmbeddingProvider;
import eu.virtualparadox.flockqa.rag.embed.QueryEncoder;
import eu.virtualparadox.flockqa.rag.partition.service.PartitionStore;
import eu.virtualparadox.flockqa.rag.rerank.service.ResultRanker;
import eu.virtualparadox.flockqa.rag.retriever.service.VectorSearcher;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static eu.virtualparadox.flockqa.testsupport.PartitionFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class RetrievalOrchestratorTest {

    @TempDir
    Path root;

    private ApplicationConfig config;
    private PartitionStore store;

    /**
     * Always answers with the first axis, so the first record of a partition is the nearest.
     */
    private static final QueryEncoder AXIS_ENCODER = new QueryEncoder() {
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
            return axis(0, DIMENSION);
        }
    };

    /**
     * Moves one minute forward on every read.
     */
    private static final class SteppingClock extends Clock {
        private Instant now = Instant.parse("2024-01-01T00:00:00Z");

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(final ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            final Instant current = now;
            now = now.plus(Duration.ofMinutes(1));
            return current;
        }
    }

    @BeforeEach
    void setUp() {
        config = config(root);
        store = store(config);
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    private RetrievalOrchestrator orchestrator(final Clock clock) {
        return new RetrievalOrchestrator(
                config,
                new DomainClassifier(),
                store,
                new EmbeddingProvider(store, List.of(AXIS_ENCODER)),
                new VectorSearcher(store),
                new ResultRanker(config),
                new AnswerSynthesizer(config),
                clock);
    }

    private RetrievalOrchestrator orchestrator() {
        return orchestrator(Clock.systemUTC());
    }

    private static List<Map<String, Object>> records(final String prefix, final int count, final Map<String, Object> metadata) {
        final List<Map<String, Object>> records = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            records.add(record(prefix + " passage " + i, metadata));
        }
        return records;
    }

    @Test
    @DisplayName("Confident broiler query is answered from the broiler partition alone")
    void testClassifiedPartition() throws IOException {
        neuralPartition(root, "broiler", records("broiler", 1, Map.of("species", "broiler")));
        neuralPartition(root, "global", records("global", 3, Map.of()));

        final RetrievalResult result = orchestrator().retrieve("FCR at 35 days for Ross 308", 5).orElseThrow();

        assertEquals("broiler", result.diagnostics().partitionUsed());
        assertEquals("broiler", result.diagnostics().detectedLabel());
        assertEquals(List.of("broiler"), result.diagnostics().partitionsTried());
        assertEquals(SearchType.VECTOR, result.diagnostics().searchType());
        assertEquals(EmbeddingMethod.NEURAL_ENCODER, result.diagnostics().embeddingMethod());
        assertEquals(1, result.diagnostics().resultCount());
        assertEquals("broiler passage 0", result.sourceDocuments().get(0).content());
        assertFalse(result.answer().isBlank());
    }

    @Test
    @DisplayName("Unclassified query starts with the generic partition")
    void testGenericFirst() throws IOException {
        neuralPartition(root, "global", records("global", 2, Map.of()));
        neuralPartition(root, "broiler", records("broiler", 2, Map.of()));

        final RetrievalResult result = orchestrator().retrieve("hello", 4).orElseThrow();

        assertEquals("global", result.diagnostics().partitionUsed());
        assertNull(result.diagnostics().detectedLabel());
        assertEquals(List.of("global"), result.diagnostics().partitionsTried());
    }

    @Test
    @DisplayName("Nothing found still records every partition tried")
    void testNothingFound() {
        final RetrievalOrchestrator orchestrator = orchestrator();
        final QueryContext context = orchestrator.createContext("hello", Map.of());

        assertTrue(orchestrator.retrieve(context, 5, Map.of()).isEmpty());
        assertEquals(List.of("global", "broiler", "layer"), context.getPartitionsTried());
        assertTrue(orchestrator.retrieveDocuments("hello", 5, Map.of()).isEmpty());
    }

    @Test
    @DisplayName("A partition below the threshold is skipped for the next one")
    void testThreshold() throws IOException {
        neuralPartition(root, "broiler", records("broiler", 1, Map.of()));
        neuralPartition(root, "layer", records("layer", 3, Map.of()));

        final RetrievalResult result = orchestrator().retrieve("hello", 4).orElseThrow();

        assertEquals("layer", result.diagnostics().partitionUsed());
        assertEquals(List.of("global", "broiler", "layer"), result.diagnostics().partitionsTried());
        assertEquals(3, result.results().size());
        assertEquals(SearchType.VECTOR, result.diagnostics().searchType());
    }

    @Test
    @DisplayName("Without an accepted partition the largest result set is returned")
    void testFallback() throws IOException {
        neuralPartition(root, "broiler", records("broiler", 2, Map.of()));
        neuralPartition(root, "layer", records("layer", 1, Map.of()));

        final RetrievalResult result = orchestrator().retrieve("hello", 6).orElseThrow();

        assertEquals("broiler", result.diagnostics().partitionUsed());
        assertEquals(2, result.diagnostics().resultCount());
        assertEquals(SearchType.VECTOR_FALLBACK, result.diagnostics().searchType());
        assertEquals(List.of("global", "broiler", "layer"), result.diagnostics().partitionsTried());
    }

    @Test
    @DisplayName("Species filter provides the hint and restricts the records")
    void testFilters() throws IOException {
        final List<Map<String, Object>> layer = new ArrayList<>();
        layer.add(record("laying hen passage", Map.of("species", "layer")));
        layer.add(record("broiler passage in layer index", Map.of("species", "broiler")));
        neuralPartition(root, "layer", layer);
        neuralPartition(root, "global", records("global", 3, Map.of()));

        final RetrievalOrchestrator orchestrator = orchestrator();
        final QueryContext context = orchestrator.createContext("hello", Map.of("species", "Layer", "line", ""));
        assertEquals("layer", context.getDomainHint());
        assertEquals(0.5, context.getConfidence(), 1e-9);

        final RetrievalResult result = orchestrator.retrieve(context, 3, Map.of("species", "Layer", "line", "")).orElseThrow();

        assertEquals("layer", result.diagnostics().partitionUsed());
        assertEquals(List.of("layer"), result.diagnostics().partitionsTried());
        assertEquals(SearchType.VECTOR_FILTERED, result.diagnostics().searchType());
        assertEquals(Map.of("species", "Layer"), result.diagnostics().filtersApplied());
        assertEquals(1, result.results().size());
        assertEquals("laying hen passage", result.sourceDocuments().get(0).content());
    }

    @Test
    @DisplayName("Species filter naming no known partition gives no hint")
    void testUnknownSpeciesFilter() throws IOException {
        config.getStorage().setRoot(root.resolve("data"));
        neuralPartition(root, "outside", records("outside", 3, Map.of("species", "../outside")));
        neuralPartition(root.resolve("data"), "global", records("global", 3, Map.of("species", "../outside")));

        final RetrievalOrchestrator orchestrator = orchestrator();
        final Map<String, String> filters = Map.of("species", "../outside");
        final QueryContext context = orchestrator.createContext("hello", filters);
        assertNull(context.getDomainHint());
        assertEquals(0.0, context.getConfidence());

        final RetrievalResult result = orchestrator.retrieve(context, 3, filters).orElseThrow();
        assertEquals("global", result.diagnostics().partitionUsed());
        assertEquals(List.of("global"), result.diagnostics().partitionsTried());
        assertEquals(List.of("broiler", "layer", "global"), List.copyOf(store.describe().keySet()));
    }

    @Test
    @DisplayName("Species alias is mapped to its partition")
    void testSpeciesAliasHint() {
        final QueryContext context = orchestrator().createContext("hello", Map.of("species", "Pondeuse"));
        assertEquals("layer", context.getDomainHint());
        assertEquals(0.5, context.getConfidence(), 1e-9);
    }

    @Test
    @DisplayName("Unknown hint on a caller-built context falls back to the generic partition")
    void testUnknownHintContext() throws IOException {
        neuralPartition(root, "global", records("global", 2, Map.of()));
        final QueryContext context = new QueryContext("hello", "../outside", 0.9);

        final RetrievalResult result = orchestrator().retrieve(context, 4, Map.of()).orElseThrow();

        assertEquals("global", result.diagnostics().partitionUsed());
        assertEquals(List.of("global"), context.getPartitionsTried());
    }

    @Test
    @DisplayName("Candidate order follows the confidence tiers without repeats")
    void testCandidateOrder() {
        final RetrievalOrchestrator orchestrator = orchestrator();

        assertEquals(List.of("layer", "broiler", "global"), orchestrator.candidateOrder("layer", 0.9));
        assertEquals(List.of("layer", "global", "broiler"), orchestrator.candidateOrder("layer", 0.5));
        assertEquals(List.of("global", "broiler", "layer"), orchestrator.candidateOrder("layer", 0.2));
        assertEquals(List.of("global", "broiler", "layer"), orchestrator.candidateOrder("global", 0.5));
    }

    @Test
    @DisplayName("Search width widens with confidence and filters, never below the minimum")
    void testSearchWidth() {
        final RetrievalOrchestrator orchestrator = orchestrator();

        assertEquals(10, orchestrator.searchWidth(3, 0.0, false));
        assertEquals(12, orchestrator.searchWidth(6, 0.0, false));
        assertEquals(18, orchestrator.searchWidth(6, 0.8, false));
        assertEquals(24, orchestrator.searchWidth(6, 0.0, true));
    }

    @Test
    @DisplayName("Passed deadline stops after the first partition")
    void testDeadline() throws IOException {
        neuralPartition(root, "layer", records("layer", 3, Map.of()));
        config.getRetrieval().setRequestDeadline(Duration.ofSeconds(30));

        final RetrievalOrchestrator orchestrator = orchestrator(new SteppingClock());
        final QueryContext context = orchestrator.createContext("hello", Map.of());

        assertEquals(Optional.empty(), orchestrator.retrieve(context, 4, Map.of()));
        assertEquals(List.of("global"), context.getPartitionsTried());
    }

    @Test
    @DisplayName("Zero deadline disables the check")
    void testNoDeadline() throws IOException {
        neuralPartition(root, "layer", records("layer", 3, Map.of()));
        config.getRetrieval().setRequestDeadline(Duration.ZERO);

        final RetrievalResult result = orchestrator(new SteppingClock()).retrieve("hello", 4).orElseThrow();

        assertEquals("layer", result.diagnostics().partitionUsed());
    }

    @Test
    @DisplayName("Non-positive k is rejected")
    void testInvalidK() {
        final RetrievalOrchestrator orchestrator = orchestrator();
        assertThrows(IllegalArgumentException.class, () -> orchestrator.retrieve("hello", 0));
    }
}
