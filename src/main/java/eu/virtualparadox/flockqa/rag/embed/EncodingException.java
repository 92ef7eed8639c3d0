package eu.virtualparadox.flockqa.rag.embed;

/**
 * A query encoder could not produce a vector.
 */
public class EncodingException extends Exception {

    public EncodingException(final String message) {
        super(message);
    }

    public EncodingException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
