package com.eldplanner.routing;

import com.eldplanner.model.Coordinate;

/**
 * Source of leg distance and duration between two points.
 */
public interface RouteProvider {

    LegEstimate estimate(Coordinate from, Coordinate to);

    /**
     * True when estimates are straight-line approximations rather than road routes.
     */
    default boolean isFallback() {
        return false;
    }
}
