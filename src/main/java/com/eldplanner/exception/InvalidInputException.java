package com.eldplanner.exception;

/**
 * A request value is present but outside what the planner accepts,
 * such as an unknown weekly cycle or a negative cycle balance.
 */
public class InvalidInputException extends PlannerException {

    public InvalidInputException(String message) {
        super(message);
    }
}
