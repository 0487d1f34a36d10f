package de.upb.sse.jsweep.exceptions;

/**
 * Deleting a valid symbol, or persisting a modified file, failed.
 */
public class MutationException extends Exception {

    public MutationException(String message) {
        super(message);
    }

    public MutationException(String message, Throwable cause) {
        super(message, cause);
    }
}
