package com.eldplanner.exception;

/**
 * A reverse-geocoding lookup failed or timed out. Never fatal to planning.
 */
public class LocationResolutionException extends PlannerException {

    public LocationResolutionException(String message) {
        super(message);
    }

    public LocationResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
