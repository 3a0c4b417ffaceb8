package io.leadscore.engine.exceptions;

/**
 * Base exception for lead scoring operations.
 */
public class ScoringException extends RuntimeException {

    public ScoringException(String message) {
        super(message);
    }

    public ScoringException(String message, Throwable cause) {
        super(message, cause);
    }
}
