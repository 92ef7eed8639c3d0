package eu.virtualparadox.flockqa.rag.partition.service;

/**
 * Raised while reading a partition from disk. Never escapes {@link PartitionStore#ensureLoaded(String)}.
 */
public class PartitionLoadException extends RuntimeException {

    public PartitionLoadException(final String message) {
        super(message);
    }

    public PartitionLoadException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
