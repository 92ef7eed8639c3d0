package eu.virtualparadox.flockqa.rag.rerank.model;

import eu.virtualparadox.flockqa.rag.partition.model.DocumentRecord;

/**
 * A search hit before ranking.
 *
 * @param document matched record
 * @param rawScore squared L2 distance reported by the index, lower is closer
 */
public record Candidate(DocumentRecord document, double rawScore) {
}
