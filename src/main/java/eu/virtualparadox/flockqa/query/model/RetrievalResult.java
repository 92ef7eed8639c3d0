package eu.virtualparadox.flockqa.query.model;

import eu.virtualparadox.flockqa.rag.partition.model.DocumentRecord;
import eu.virtualparadox.flockqa.rag.rerank.model.RankedResult;

import java.util.List;

/**
 * Outcome of a successful retrieval.
 *
 * @param answer          synthesized answer text
 * @param results         ranked results, best first, at most {@code k}
 * @param diagnostics     how the results were obtained
 */
public record RetrievalResult(String answer,
                              List<RankedResult> results,
                              RetrievalDiagnostics diagnostics) {

    public RetrievalResult {
        results = List.copyOf(results);
    }

    /**
     * @return the documents behind {@link #results()}, same order
     */
    public List<DocumentRecord> sourceDocuments() {
        return results.stream().map(RankedResult::document).toList();
    }
}
