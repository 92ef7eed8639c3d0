package eu.virtualparadox.flockqa.rag.classify.model;

/**
 * @param keyword lowercase phrase, matched as a substring
 * @param weight  3 for strain/product names, 2 for strong domain terms, 1 for weak hints
 */
public record WeightedKeyword(String keyword, int weight) {
}
