package eu.virtualparadox.flockqa.query;

import eu.virtualparadox.flockqa.application.config.ApplicationConfig;
import eu.virtualparadox.flockqa.query.filter.MetadataFilter;
import eu.virtualparadox.flockqa.query.model.QueryContext;
import eu.virtualparadox.flockqa.query.model.RetrievalDiagnostics;
import eu.virtualparadox.flockqa.query.model.RetrievalResult;
import eu.virtualparadox.flockqa.query.model.SearchType;
import eu.virtualparadox.flockqa.rag.answer.AnswerSynthesizer;
import eu.virtualparadox.flockqa.rag.classify.model.DomainClassification;
import eu.virtualparadox.flockqa.rag.classify.service.DomainClassifier;
import eu.virtualparadox.flockqa.rag.embed.EmbeddingProvider;
import eu.virtualparadox.flockqa.rag.partition.model.DocumentRecord;
import eu.virtualparadox.flockqa.rag.partition.model.Partition;
import eu.virtualparadox.flockqa.rag.partition.service.PartitionStore;
import eu.virtualparadox.flockqa.rag.rerank.model.Candidate;
import eu.virtualparadox.flockqa.rag.rerank.model.RankedResult;
import eu.virtualparadox.flockqa.rag.rerank.service.ResultRanker;
import eu.virtualparadox.flockqa.rag.retriever.model.SearchHits;
import eu.virtualparadox.flockqa.rag.retriever.service.VectorSearcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Drives one query from classification to answer.
 * <p>
 * Partitions are tried in an order that depends on the classifier confidence:
 * <ul>
 *   <li>above {@code highConfidence}: classified partition, then the others</li>
 *   <li>above {@code mediumConfidence}: classified, generic, then the others</li>
 *   <li>otherwise: generic, then the others</li>
 * </ul>
 * A partition's results are accepted when they reach the acceptance threshold or come from the
 * classified partition. Otherwise the largest result set seen so far is returned once every
 * candidate has been tried or the request deadline has passed.
 */
@Service
@Slf4j
public class RetrievalOrchestrator {

    static final String FILTER_HINT_KEY = MetadataFilter.KEY_SPECIES;
    static final double FILTER_HINT_CONFIDENCE = 0.5;

    private final ApplicationConfig config;
    private final DomainClassifier classifier;
    private final PartitionStore partitionStore;
    private final EmbeddingProvider embeddingProvider;
    private final VectorSearcher vectorSearcher;
    private final ResultRanker resultRanker;
    private final AnswerSynthesizer answerSynthesizer;
    private final Clock clock;

    @Autowired
    public RetrievalOrchestrator(final ApplicationConfig config,
                                 final DomainClassifier classifier,
                                 final PartitionStore partitionStore,
                                 final EmbeddingProvider embeddingProvider,
                                 final VectorSearcher vectorSearcher,
                                 final ResultRanker resultRanker,
                                 final AnswerSynthesizer answerSynthesizer) {
        this(config, classifier, partitionStore, embeddingProvider, vectorSearcher, resultRanker, answerSynthesizer,
                Clock.systemUTC());
    }

    RetrievalOrchestrator(final ApplicationConfig config,
                          final DomainClassifier classifier,
                          final PartitionStore partitionStore,
                          final EmbeddingProvider embeddingProvider,
                          final VectorSearcher vectorSearcher,
                          final ResultRanker resultRanker,
                          final AnswerSynthesizer answerSynthesizer,
                          final Clock clock) {
        this.config = config;
        this.classifier = classifier;
        this.partitionStore = partitionStore;
        this.embeddingProvider = embeddingProvider;
        this.vectorSearcher = vectorSearcher;
        this.resultRanker = resultRanker;
        this.answerSynthesizer = answerSynthesizer;
        this.clock = clock;
    }

    public Optional<RetrievalResult> retrieve(final String query, final int k) {
        return retrieve(query, k, Map.of());
    }

    /**
     * @param query   user query
     * @param k       maximum number of results
     * @param filters metadata filters; empty values are ignored
     * @return the answer with its sources and diagnostics, or empty when no partition produced results
     */
    public Optional<RetrievalResult> retrieve(final String query, final int k, final Map<String, ?> filters) {
        Objects.requireNonNull(query, "query");
        return retrieve(createContext(query, filters), k, filters);
    }

    /**
     * @return the source documents of {@link #retrieve(String, int, Map)}, empty when nothing was found
     */
    public List<DocumentRecord> retrieveDocuments(final String query, final int k, final Map<String, ?> filters) {
        return retrieve(query, k, filters)
                .map(RetrievalResult::sourceDocuments)
                .orElse(List.of());
    }

    /**
     * Classifies the query. Without a label, a {@code species} filter naming a configured domain
     * partition becomes the hint with confidence {@value #FILTER_HINT_CONFIDENCE}. Any other
     * filter value is ignored for ordering.
     */
    public QueryContext createContext(final String query, final Map<String, ?> filters) {
        final DomainClassification classification = classifier.classify(query);
        if (classification.label() != null) {
            return new QueryContext(query, classification.label(), classification.confidence());
        }
        final Optional<String> species = Optional.ofNullable(MetadataFilter.applied(filters).get(FILTER_HINT_KEY))
                .flatMap(MetadataFilter::species)
                .filter(config.getPartitions().getDomains()::contains);
        if (species.isPresent()) {
            return new QueryContext(query, species.get(), FILTER_HINT_CONFIDENCE);
        }
        return new QueryContext(query, null, 0.0);
    }

    /**
     * Runs retrieval for an already classified query. Every partition attempted is appended to
     * {@code context.getPartitionsTried()}, also when nothing is found.
     */
    public Optional<RetrievalResult> retrieve(final QueryContext context, final int k, final Map<String, ?> filters) {
        Objects.requireNonNull(context, "context");
        if (k <= 0) {
            throw new IllegalArgumentException("k must be positive: " + k);
        }
        final Map<String, String> applied = MetadataFilter.applied(filters);
        if (!applied.isEmpty()) {
            log.info("Retrieval with filters {}", applied);
        }

        final String hint = hintPartition(context.getDomainHint());
        final List<String> candidates = candidateOrder(hint, context.getConfidence());
        final boolean filtered = !applied.isEmpty();
        final int threshold = filtered ? Math.max(1, k / 3) : k / 2;

        final Instant start = clock.instant();
        final Duration deadline = config.getRetrieval().getRequestDeadline();

        Attempt best = null;
        for (final String partitionId : candidates) {
            if (!context.getPartitionsTried().isEmpty() && deadlinePassed(start, deadline)) {
                log.warn("Request deadline {} passed after {}, skipping remaining partitions",
                        deadline, context.getPartitionsTried());
                break;
            }
            context.markTried(partitionId);

            final Optional<Attempt> attempt = attempt(context, partitionId, k, applied);
            if (attempt.isEmpty()) {
                continue;
            }
            final Attempt current = attempt.get();
            if (best == null || current.results().size() > best.results().size()) {
                best = current;
            }

            if (current.results().size() >= threshold || partitionId.equals(hint)) {
                log.info("Accepted {} results from partition {} (tried {})",
                        current.results().size(), partitionId, context.getPartitionsTried());
                return Optional.of(result(context, current, SearchType.of(false, filtered), applied));
            }
            log.debug("Partition {} gave {} results, below threshold {}", partitionId, current.results().size(), threshold);
        }

        if (best != null) {
            log.info("Falling back to {} results from partition {} (tried {})",
                    best.results().size(), best.partition().id(), context.getPartitionsTried());
            return Optional.of(result(context, best, SearchType.of(true, filtered), applied));
        }

        log.warn("No valid result in partitions {} (filters {})", String.join(" -> ", context.getPartitionsTried()), applied);
        return Optional.empty();
    }

    /**
     * @return the configured partition named by {@code domainHint}, or the generic one
     */
    private String hintPartition(final String domainHint) {
        if (domainHint != null) {
            for (final String id : config.getPartitions().all()) {
                if (id.equalsIgnoreCase(domainHint.strip())) {
                    return id;
                }
            }
            log.warn("Domain hint '{}' names no configured partition, using {}", domainHint, config.getPartitions().getGeneric());
        }
        return config.getPartitions().getGeneric();
    }

    /**
     * Order in which partitions are tried for a hint and its confidence. Partitions never repeat.
     */
    List<String> candidateOrder(final String hint, final double confidence) {
        final ApplicationConfig.Retrieval retrieval = config.getRetrieval();
        final String generic = config.getPartitions().getGeneric();

        final Set<String> order = new LinkedHashSet<>();
        if (confidence > retrieval.getHighConfidence()) {
            order.add(hint);
        } else if (confidence > retrieval.getMediumConfidence()) {
            order.add(hint);
            order.add(generic);
        } else {
            order.add(generic);
        }
        order.addAll(config.getPartitions().all());
        return new ArrayList<>(order);
    }

    /**
     * Load, encode, search, filter and rank within one partition.
     *
     * @return ranked results truncated to {@code k}, or empty when any step yielded nothing
     */
    private Optional<Attempt> attempt(final QueryContext context,
                                      final String partitionId,
                                      final int k,
                                      final Map<String, String> filters) {
        if (!partitionStore.ensureLoaded(partitionId)) {
            return Optional.empty();
        }
        final Optional<Partition> loaded = partitionStore.find(partitionId);
        if (loaded.isEmpty()) {
            return Optional.empty();
        }
        final Partition partition = loaded.get();

        final Optional<float[]> vector = embeddingProvider.encode(
                context.getRawQuery(), partition.embeddingMethod(), partitionId);
        if (vector.isEmpty()) {
            log.warn("Query embedding failed for partition {}", partitionId);
            return Optional.empty();
        }

        final Optional<SearchHits> hits = vectorSearcher.search(partitionId, vector.get(), searchWidth(k, context.getConfidence(), !filters.isEmpty()));
        if (hits.isEmpty()) {
            return Optional.empty();
        }

        List<Candidate> candidates = toCandidates(partition, hits.get());
        printDebugCandidates(partitionId, candidates);
        if (!filters.isEmpty()) {
            candidates = candidates.stream()
                    .filter(c -> MetadataFilter.matches(c.document(), filters))
                    .toList();
            log.debug("{} candidates left in {} after filtering", candidates.size(), partitionId);
        }
        if (candidates.isEmpty()) {
            return Optional.empty();
        }

        final List<RankedResult> ranked = resultRanker.rank(context.getRawQuery(), candidates);
        final List<RankedResult> limited = ranked.subList(0, Math.min(k, ranked.size()));
        printDebugRanked(partitionId, limited);
        return Optional.of(new Attempt(partition, List.copyOf(limited)));
    }

    int searchWidth(final int k, final double confidence, final boolean filtered) {
        final ApplicationConfig.Retrieval retrieval = config.getRetrieval();
        final int multiplier;
        if (filtered) {
            multiplier = retrieval.getFilteredWidthMultiplier();
        } else if (confidence > retrieval.getWideSearchConfidence()) {
            multiplier = retrieval.getConfidentWidthMultiplier();
        } else {
            multiplier = retrieval.getDefaultWidthMultiplier();
        }
        return Math.max(k * multiplier, retrieval.getMinSearchWidth());
    }

    private static List<Candidate> toCandidates(final Partition partition, final SearchHits hits) {
        final List<DocumentRecord> documents = partition.documents();
        final List<Candidate> candidates = new ArrayList<>(hits.size());
        for (int i = 0; i < hits.size(); i++) {
            final int ordinal = hits.indices()[i];
            if (ordinal >= 0 && ordinal < documents.size()) {
                candidates.add(new Candidate(documents.get(ordinal), hits.distances()[i]));
            }
        }
        return candidates;
    }

    private boolean deadlinePassed(final Instant start, final Duration deadline) {
        if (deadline == null || deadline.isZero() || deadline.isNegative()) {
            return false;
        }
        return Duration.between(start, clock.instant()).compareTo(deadline) > 0;
    }

    private RetrievalResult result(final QueryContext context,
                                   final Attempt attempt,
                                   final SearchType searchType,
                                   final Map<String, String> filters) {
        final String answer = answerSynthesizer.synthesize(context.getRawQuery(), attempt.results());
        log.debug(" !!! Synthesized answer:\n{}", answer);

        final RetrievalDiagnostics diagnostics = new RetrievalDiagnostics(
                attempt.partition().id(),
                context.getDomainHint(),
                context.getConfidence(),
                context.getPartitionsTried(),
                attempt.partition().embeddingMethod(),
                attempt.results().size(),
                searchType,
                filters);
        return new RetrievalResult(answer, attempt.results(), diagnostics);
    }

    private void printDebugCandidates(final String partitionId, final List<Candidate> candidates) {
        if (!log.isDebugEnabled()) {
            return;
        }
        final StringBuilder sb = new StringBuilder();
        for (final Candidate c : candidates) {
            sb.append(" - ").append("[").append(c.rawScore()).append("] ").append(c.document().content()).append("\n");
        }
        log.debug(" !!! Retrieved from {}:\n{}", partitionId, sb);
    }

    private void printDebugRanked(final String partitionId, final List<RankedResult> ranked) {
        if (!log.isDebugEnabled()) {
            return;
        }
        final StringBuilder sb = new StringBuilder();
        for (final RankedResult r : ranked) {
            sb.append(" - ").append("[").append(r.finalScore()).append("] ").append(r.document().content()).append("\n");
        }
        log.debug(" !!! Ranked in {}:\n{}", partitionId, sb);
    }

    private record Attempt(Partition partition, List<RankedResult> results) {
    }
}
