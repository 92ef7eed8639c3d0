package eu.virtualparadox.flockqa.query.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-request state of one retrieval.
 */
@Getter
@ToString
@RequiredArgsConstructor
public class QueryContext {

    private final String rawQuery;
    /** Label from the classifier or the species filter; {@code null} when neither gave one. */
    private final String domainHint;
    private final double confidence;
    /** Partitions attempted so far, in order. */
    private final List<String> partitionsTried = new ArrayList<>();

    public void markTried(final String partitionId) {
        partitionsTried.add(partitionId);
    }
}
