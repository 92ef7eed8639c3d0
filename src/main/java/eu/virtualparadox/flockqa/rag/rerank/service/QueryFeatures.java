package eu.virtualparadox.flockqa.rag.rerank.service;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Lexical traits of a query that drive ranking and answer layout.
 */
public final class QueryFeatures {

    /** Alphabetic units, matched as whole words so that "g" does not fire on every word containing a g. */
    private static final List<String> WORD_UNITS = List.of(
            "kg", "g", "fcr", "ppm", "m3", "lux", "pa", "kcal", "mj", "mg",
            "days", "weeks", "jours", "semaines", "density", "densité");

    /** Units containing symbols, matched as substrings. */
    private static final List<String> SYMBOL_UNITS = List.of(
            "%", "°c", "m³", "birds/m²", "sujets/m²");

    private static final List<String> PERFORMANCE_TERMS = List.of(
            "rate", "taux", "ratio", "indice", "conversion", "gain",
            "production", "efficiency", "mortality", "viability");

    private static final List<String> PERF_TARGET_TERMS = List.of("poids", "weight", "performance");

    private static final Pattern WORD_UNIT_PATTERN = Pattern.compile(
            "(?<![\\p{L}\\p{N}])(?:" + String.join("|", WORD_UNITS) + ")(?![\\p{L}\\p{N}])");

    private QueryFeatures() {
        // prevent instantiation
    }

    /**
     * @return true when the query holds a digit, a unit token or a performance indicator
     */
    public static boolean isTechnical(final String query) {
        if (query == null || query.isEmpty()) {
            return false;
        }
        final String q = query.toLowerCase(Locale.ROOT);
        return hasDigit(q)
                || WORD_UNIT_PATTERN.matcher(q).find()
                || containsAny(q, SYMBOL_UNITS)
                || containsAny(q, PERFORMANCE_TERMS);
    }

    /**
     * @return true when the query asks about weight or performance targets
     */
    public static boolean hasPerformanceTargetsIntent(final String query) {
        return query != null && containsAny(query.toLowerCase(Locale.ROOT), PERF_TARGET_TERMS);
    }

    private static boolean hasDigit(final String q) {
        for (int i = 0; i < q.length(); i++) {
            if (Character.isDigit(q.charAt(i))) {
                return true;
            }
        }
        return false;
    }

    private static boolean containsAny(final String q, final List<String> terms) {
        for (final String t : terms) {
            if (q.contains(t)) {
                return true;
            }
        }
        return false;
    }
}
