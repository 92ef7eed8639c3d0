package eu.virtualparadox.flockqa.query.model;

import eu.virtualparadox.flockqa.rag.embed.EmbeddingMethod;

import java.util.List;
import java.util.Map;

/**
 * @param partitionUsed   partition the results come from
 * @param detectedLabel   domain hint used for candidate ordering, {@code null} when none
 * @param confidence      confidence of that hint
 * @param partitionsTried every partition attempted, in order
 * @param embeddingMethod method of {@code partitionUsed}
 * @param resultCount     number of source documents
 * @param searchType      direct or fallback, filtered or not
 * @param filtersApplied  non-empty filters the results were restricted by
 */
public record RetrievalDiagnostics(String partitionUsed,
                                   String detectedLabel,
                                   double confidence,
                                   List<String> partitionsTried,
                                   EmbeddingMethod embeddingMethod,
                                   int resultCount,
                                   SearchType searchType,
                                   Map<String, String> filtersApplied) {

    public RetrievalDiagnostics {
        partitionsTried = List.copyOf(partitionsTried);
        filtersApplied = Map.copyOf(filtersApplied);
    }
}
