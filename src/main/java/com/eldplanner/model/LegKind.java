package com.eldplanner.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Position of a route leg within the trip.
 */
public enum LegKind {
    TO_PICKUP("to_pickup"),
    TO_DROPOFF("to_dropoff");

    private final String code;

    LegKind(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
