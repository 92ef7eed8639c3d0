package eu.virtualparadox.flockqa.rag.rerank.model;

import eu.virtualparadox.flockqa.rag.partition.model.DocumentRecord;

/**
 * @param document   matched record
 * @param rawScore   distance reported by the index
 * @param finalScore relevance in {@code [0, 1]}, bonuses included
 */
public record RankedResult(DocumentRecord document, double rawScore, double finalScore) {

    public RankedResult {
        if (!(finalScore >= 0.0 && finalScore <= 1.0)) {
            throw new IllegalArgumentException("finalScore out of range: " + finalScore);
        }
    }
}
