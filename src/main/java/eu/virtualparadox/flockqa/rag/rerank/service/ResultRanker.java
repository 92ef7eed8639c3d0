package eu.virtualparadox.flockqa.rag.rerank.service;

import eu.virtualparadox.flockqa.application.config.ApplicationConfig;
import eu.virtualparadox.flockqa.rag.partition.model.DocumentRecord;
import eu.virtualparadox.flockqa.rag.rerank.model.Candidate;
import eu.virtualparadox.flockqa.rag.rerank.model.RankedResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns index distances into bounded relevance scores and promotes structured, data-rich
 * passages for technical queries.
 * <p>
 * {@code base = 1} for a non-positive distance, otherwise {@code exp(-distance * decay)}.
 * Non-technical queries keep the index order with {@code finalScore = base}. Technical queries
 * add the bonuses below, cap the sum at 1 and sort descending, ties keeping index order:
 * <ul>
 *   <li>structured-content heuristic</li>
 *   <li>{@code chunk_type=table}</li>
 *   <li>{@code domain} in the technical-domain set</li>
 *   <li>first matching numeric pattern (one bonus at most)</li>
 *   <li>query/passage token overlap, capped</li>
 *   <li>{@code table_type=perf_targets} when the query asks for weight or performance targets</li>
 * </ul>
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ResultRanker {

    public static final String KEY_DOMAIN = "domain";
    public static final String TABLE_TYPE_PERF_TARGETS = "perf_targets";

    private static final List<Pattern> NUMERIC_PATTERNS = List.of(
            Pattern.compile("\\d+\\s*(?:kg|g|%|°c|days?|weeks?|fcr)"),
            Pattern.compile("(?:protein|lysine|calcium|energy)\\s*[:=]\\s*\\d+"),
            Pattern.compile("(?:mortality|growth|conversion)\\s*[:=]\\s*\\d+"));

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final ApplicationConfig config;

    public List<RankedResult> rank(final String query, final List<Candidate> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return List.of();
        }

        final ApplicationConfig.Ranking ranking = config.getRanking();
        final List<RankedResult> results = new ArrayList<>(candidates.size());

        if (!QueryFeatures.isTechnical(query)) {
            for (final Candidate c : candidates) {
                results.add(new RankedResult(c.document(), c.rawScore(), baseScore(c.rawScore(), ranking.getDistanceDecay())));
            }
            return results;
        }

        final boolean perfTargets = QueryFeatures.hasPerformanceTargetsIntent(query);
        final Set<String> queryTokens = tokens(query);

        for (final Candidate c : candidates) {
            final DocumentRecord doc = c.document();
            final double base = baseScore(c.rawScore(), ranking.getDistanceDecay());
            double bonus = 0.0;

            if (perfTargets && TABLE_TYPE_PERF_TARGETS.equals(doc.metadataString(StructuredContentDetector.KEY_TABLE_TYPE))) {
                bonus += ranking.getPerfTargetsBonus();
            }
            if (StructuredContentDetector.looksLikeTable(doc)) {
                bonus += ranking.getTableHeuristicBonus();
            }
            if (StructuredContentDetector.isTableChunk(doc)) {
                bonus += ranking.getTableMetadataBonus();
            }
            final String domain = doc.metadataString(KEY_DOMAIN);
            if (domain != null && ranking.getTechnicalDomains().contains(domain)) {
                bonus += ranking.getTechnicalDomainBonus();
            }
            if (matchesNumericPattern(doc.content())) {
                bonus += ranking.getNumericPatternBonus();
            }
            bonus += overlapBonus(queryTokens, doc.content(), ranking.getOverlapCap());

            results.add(new RankedResult(doc, c.rawScore(), Math.min(1.0, base + bonus)));
        }

        results.sort(Comparator.comparingDouble(RankedResult::finalScore).reversed());
        log.debug("Re-ranked {} candidates for technical query (perf targets: {})", results.size(), perfTargets);
        return results;
    }

    /**
     * @return {@code exp(-distance * decay)} clamped to {@code [0, 1]}; 1 for non-positive distances
     */
    static double baseScore(final double distance, final double decay) {
        if (distance <= 0.0) {
            return 1.0;
        }
        final double score = Math.exp(-distance * decay);
        if (Double.isNaN(score)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, score));
    }

    private static boolean matchesNumericPattern(final String content) {
        final String text = content.toLowerCase(Locale.ROOT);
        for (final Pattern p : NUMERIC_PATTERNS) {
            if (p.matcher(text).find()) {
                return true;
            }
        }
        return false;
    }

    static double overlapBonus(final Set<String> queryTokens, final String content, final double cap) {
        if (queryTokens.isEmpty()) {
            return 0.0;
        }
        final Set<String> shared = new HashSet<>(queryTokens);
        shared.retainAll(tokens(content));
        final double ratio = (double) shared.size() / queryTokens.size();
        return Math.min(cap, ratio * cap);
    }

    static Set<String> tokens(final String text) {
        final Set<String> tokens = new HashSet<>();
        if (text == null) {
            return tokens;
        }
        for (final String t : WHITESPACE.split(text.toLowerCase(Locale.ROOT).trim())) {
            if (!t.isEmpty()) {
                tokens.add(t);
            }
        }
        return tokens;
    }
}
