package io.leadscore.engine.exceptions;

/**
 * Wraps a failure of a lead, rate or watermark store.
 */
public class ScoringPersistenceException extends ScoringException {

    public ScoringPersistenceException(String message) {
        super(message);
    }

    public ScoringPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
