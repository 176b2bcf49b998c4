package com.eldplanner.exception;

/**
 * The request lacks the legs or waypoints needed to build a schedule.
 * Always fatal to the call.
 */
public class InsufficientInputException extends PlannerException {

    public InsufficientInputException(String message) {
        super(message);
    }
}
