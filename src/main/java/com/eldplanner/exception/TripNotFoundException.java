package com.eldplanner.exception;

public class TripNotFoundException extends PlannerException {

    public TripNotFoundException(String tripId) {
        super("Trip not found: " + tripId);
    }
}
