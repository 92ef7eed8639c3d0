package eu.virtualparadox.flockqa.query.filter;

import eu.virtualparadox.flockqa.rag.partition.model.DocumentRecord;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Restricts records by metadata values.
 * <p>
 * A record passes when it matches every non-empty filter. A single filter matches when the
 * record has the key and, compared lowercased and trimmed:
 * <ul>
 *   <li>the values are equal, or</li>
 *   <li>{@code species}: the filter is an alias of a group and the record value contains one of its aliases, or</li>
 *   <li>{@code sex}: the filter is an alias of a group and one of its aliases appears as a whole word in the record value, or</li>
 *   <li>{@code line}: one value contains the other, also after stripping punctuation, or</li>
 *   <li>for other keys, the record value contains the filter value.</li>
 * </ul>
 */
public final class MetadataFilter {

    public static final String KEY_SPECIES = "species";
    public static final String KEY_SEX = "sex";
    public static final String KEY_LINE = "line";

    private static final List<List<String>> SPECIES_ALIASES = List.of(
            List.of("broiler", "chair", "meat", "ross", "cobb"),
            List.of("layer", "pondeuse", "laying", "egg", "lohmann", "hy-line", "isa"));

    private static final List<List<String>> SEX_ALIASES = List.of(
            List.of("male", "mâle", "males", "m"),
            List.of("female", "femelle", "females", "f"),
            List.of("mixed", "mixte", "both", "les deux"));

    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}_]");

    private MetadataFilter() {
        // prevent instantiation
    }

    /**
     * @return the filters with a non-empty value, values rendered as strings, in input order
     */
    public static Map<String, String> applied(final Map<String, ?> filters) {
        final Map<String, String> applied = new LinkedHashMap<>();
        if (filters == null) {
            return applied;
        }
        filters.forEach((key, value) -> {
            if (key != null && value != null && !String.valueOf(value).isBlank()) {
                applied.put(key, String.valueOf(value));
            }
        });
        return applied;
    }

    /**
     * @return the species a filter value names ({@code broiler} or {@code layer}), or empty when
     * the value is not one of the species aliases
     */
    public static Optional<String> species(final String filterValue) {
        if (filterValue == null) {
            return Optional.empty();
        }
        final String value = normalize(filterValue);
        for (final List<String> aliases : SPECIES_ALIASES) {
            if (aliases.contains(value)) {
                return Optional.of(aliases.get(0));
            }
        }
        return Optional.empty();
    }

    public static boolean matches(final DocumentRecord document, final Map<String, String> appliedFilters) {
        for (final Map.Entry<String, String> f : appliedFilters.entrySet()) {
            if (!matches(document, f.getKey(), f.getValue())) {
                return false;
            }
        }
        return true;
    }

    static boolean matches(final DocumentRecord document, final String key, final String filterValue) {
        if (filterValue == null || filterValue.isBlank()) {
            return true;
        }
        final Object docValue = document.metadata().get(key);
        if (docValue == null) {
            return false;
        }

        final String filter = normalize(filterValue);
        final String value = normalize(String.valueOf(docValue));
        if (filter.equals(value)) {
            return true;
        }

        switch (key) {
            case KEY_SPECIES -> {
                if (matchesAliasGroup(SPECIES_ALIASES, filter, value)) {
                    return true;
                }
            }
            case KEY_SEX -> {
                return containsWord(value, filter) || matchesWholeWordAlias(filter, value);
            }
            case KEY_LINE -> {
                if (containsEither(filter, value)) {
                    return true;
                }
                final String filterClean = NON_WORD.matcher(filter).replaceAll("");
                final String valueClean = NON_WORD.matcher(value).replaceAll("");
                if (containsEither(filterClean, valueClean)) {
                    return true;
                }
            }
            default -> {
                // plain containment below
            }
        }
        return value.contains(filter);
    }

    private static boolean matchesAliasGroup(final List<List<String>> groups, final String filter, final String value) {
        for (final List<String> aliases : groups) {
            if (aliases.contains(filter) && aliases.stream().anyMatch(value::contains)) {
                return true;
            }
        }
        return false;
    }

    /**
     * "male" must not match "female", and single-letter aliases must not match any word containing that letter.
     */
    private static boolean matchesWholeWordAlias(final String filter, final String value) {
        for (final List<String> aliases : SEX_ALIASES) {
            if (!aliases.contains(filter)) {
                continue;
            }
            for (final String alias : aliases) {
                if (containsWord(value, alias)) {
                    return true;
                }
            }
        }
        return false;
    }

    private static boolean containsWord(final String value, final String word) {
        return Pattern.compile("(?<!\\p{L})" + Pattern.quote(word) + "(?!\\p{L})").matcher(value).find();
    }

    private static boolean containsEither(final String a, final String b) {
        return a.contains(b) || b.contains(a);
    }

    private static String normalize(final String value) {
        return value.toLowerCase(Locale.ROOT).strip();
    }
}
