package de.upb.sse.jsweep.exceptions;

/**
 * The code model or reference index could not be read consistently. Fatal to the current pass:
 * nothing is mutated once this has been thrown.
 */
public class ModelReadException extends RuntimeException {

    public ModelReadException(String message) {
        super(message);
    }

    public ModelReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
