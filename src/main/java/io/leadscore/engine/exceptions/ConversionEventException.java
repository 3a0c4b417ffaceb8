package io.leadscore.engine.exceptions;

/**
 * The conversion event for a job_booked transition could not be delivered.
 * The status change it belongs to is not applied.
 */
public class ConversionEventException extends ScoringException {

    public ConversionEventException(String message, Throwable cause) {
        super(message, cause);
    }
}
