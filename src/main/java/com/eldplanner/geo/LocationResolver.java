package com.eldplanner.geo;

/**
 * Reverse geocoder that turns a coordinate into a formatted place string,
 * typically {@code "street, city, region"}.
 *
 * Implementations may block and may throw; callers treat any failure as an
 * unknown place.
 */
@FunctionalInterface
public interface LocationResolver {

    String resolve(double lat, double lon);
}
