package com.eldplanner.exception;

/**
 * Base type for errors raised while planning a trip.
 */
public class PlannerException extends RuntimeException {

    public PlannerException(String message) {
        super(message);
    }

    public PlannerException(String message, Throwable cause) {
        super(message, cause);
    }
}
