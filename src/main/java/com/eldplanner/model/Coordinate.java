package com.eldplanner.model;

/**
 * Immutable geographic position in decimal degrees.
 */
public record Coordinate(double lat, double lon) {

    public Coordinate {
        if (Double.isNaN(lat) || lat < -90.0 || lat > 90.0) {
            throw new IllegalArgumentException("lat must be within [-90, 90]: " + lat);
        }
        if (Double.isNaN(lon) || lon < -180.0 || lon > 180.0) {
            throw new IllegalArgumentException("lon must be within [-180, 180]: " + lon);
        }
    }

    public static Coordinate of(double lat, double lon) {
        return new Coordinate(lat, lon);
    }
}
