package eu.virtualparadox.flockqa.rag.classify.service;

import eu.virtualparadox.flockqa.rag.classify.model.WeightedKeyword;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Keyword vocabulary per recognized domain, English and French.
 * Iteration order of {@link #BY_DOMAIN} breaks score ties: layer wins over broiler.
 */
public final class DomainKeywords {

    public static final String BROILER = "broiler";
    public static final String LAYER = "layer";

    public static final Map<String, List<WeightedKeyword>> BY_DOMAIN;

    static {
        final Map<String, List<WeightedKeyword>> map = new LinkedHashMap<>();
        map.put(LAYER, List.of(
                kw("pondeuse", 3), kw("ponte", 3), kw("œuf", 3), kw("oeuf", 3), kw("layer", 3),
                kw("lohmann brown", 3), kw("hy-line brown", 3), kw("w-36", 3), kw("w-80", 3),
                kw("lsl-lite", 3), kw("isa brown", 3),
                kw("lohmann", 2), kw("hy-line", 2), kw("hyline", 2), kw("isa", 2), kw("laying hen", 2),
                kw("poule pondeuse", 2), kw("egg production", 2), kw("hen day", 2),
                kw("w36", 1), kw("w80", 1), kw("production", 1),
                // layer ages are expressed in weeks
                kw("weeks", 1), kw("semaines", 1)));
        map.put(BROILER, List.of(
                kw("ross 308", 3), kw("ross308", 3), kw("cobb 500", 3), kw("cobb500", 3),
                kw("ross 708", 3), kw("poulet de chair", 3), kw("broiler", 3), kw("hubbard", 3),
                kw("ross", 2), kw("cobb", 2), kw("meat chicken", 2), kw("chair", 2),
                kw("griller", 2), kw("fcr", 2), kw("finisher", 2), kw("starter", 2),
                kw("croissance", 1), kw("poids", 1), kw("gain", 1), kw("weight", 1),
                // broiler ages are expressed in days
                kw("days", 1), kw("jours", 1)));
        BY_DOMAIN = Collections.unmodifiableMap(map);
    }

    private DomainKeywords() {
        // prevent instantiation
    }

    private static WeightedKeyword kw(final String keyword, final int weight) {
        return new WeightedKeyword(keyword, weight);
    }
}
