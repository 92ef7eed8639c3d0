package eu.virtualparadox.flockqa.rag.classify.service;

import eu.virtualparadox.flockqa.rag.classify.model.DomainClassification;
import eu.virtualparadox.flockqa.rag.classify.model.WeightedKeyword;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Keyword-weighted domain detection.
 * <p>
 * Each domain scores the sum of the weights of its keywords found in the lowercased query.
 * The best domain wins with {@code confidence = min(score / 10, 1)}; when the runner-up is
 * less than {@value #AMBIGUITY_GAP} points behind, the confidence is damped by
 * {@value #AMBIGUITY_DAMPING}.
 */
@Service
@Slf4j
public class DomainClassifier {

    static final double SCORE_SCALE = 10.0;
    static final int AMBIGUITY_GAP = 2;
    static final double AMBIGUITY_DAMPING = 0.6;

    private final Map<String, List<WeightedKeyword>> keywords;

    public DomainClassifier() {
        this(DomainKeywords.BY_DOMAIN);
    }

    DomainClassifier(final Map<String, List<WeightedKeyword>> keywords) {
        this.keywords = keywords;
    }

    public DomainClassification classify(final String query) {
        final String q = query == null ? "" : query.toLowerCase(Locale.ROOT);

        final Map<String, Integer> scores = new LinkedHashMap<>();
        keywords.forEach((label, list) -> scores.put(label, score(q, list)));

        String best = null;
        int bestScore = 0;
        int runnerUp = 0;
        for (final Map.Entry<String, Integer> e : scores.entrySet()) {
            final int s = e.getValue();
            if (s > bestScore) {
                runnerUp = bestScore;
                bestScore = s;
                best = e.getKey();
            } else if (s > runnerUp) {
                runnerUp = s;
            }
        }

        if (best == null) {
            log.debug("No domain keyword in '{}'", query);
            return DomainClassification.NONE;
        }

        double confidence = Math.min(bestScore / SCORE_SCALE, 1.0);
        if (scores.size() > 1 && bestScore - runnerUp < AMBIGUITY_GAP) {
            confidence *= AMBIGUITY_DAMPING;
        }
        log.debug("Domain scores {} -> {} ({})", scores, best, confidence);
        return new DomainClassification(best, confidence);
    }

    private static int score(final String query, final List<WeightedKeyword> list) {
        int total = 0;
        for (final WeightedKeyword k : list) {
            if (query.contains(k.keyword())) {
                total += k.weight();
            }
        }
        return total;
    }
}
