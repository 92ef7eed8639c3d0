package eu.virtualparadox.flockqa.rag.classify.model;

import java.util.Optional;

/**
 * Best-guess domain of a query.
 *
 * @param label      recognized domain label, {@code null} when no keyword matched
 * @param confidence in {@code [0, 1]}; {@code 0.0} whenever {@code label} is {@code null}
 */
public record DomainClassification(String label, double confidence) {

    public static final DomainClassification NONE = new DomainClassification(null, 0.0);

    public DomainClassification {
        if (confidence < 0.0 || confidence > 1.0 || Double.isNaN(confidence)) {
            throw new IllegalArgumentException("confidence out of range: " + confidence);
        }
    }

    public Optional<String> labelIfPresent() {
        return Optional.ofNullable(label);
    }
}
