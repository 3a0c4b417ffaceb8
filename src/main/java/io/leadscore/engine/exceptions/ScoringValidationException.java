package io.leadscore.engine.exceptions;

/**
 * Thrown when a request is rejected before any store is touched:
 * missing clientId, malformed filter, invalid status change or weight configuration.
 */
public class ScoringValidationException extends ScoringException {

    public ScoringValidationException(String message) {
        super(message);
    }
}
