package com.eldplanner.model;

import java.util.Objects;

/**
 * One typed leg of a trip.
 *
 * The nominal duration comes from the routing provider and is informational
 * only; scheduling derives driving time from the distance.
 */
public record RouteLeg(
    Coordinate start,
    Coordinate end,
    double distanceMiles,
    double durationHours,
    LegKind kind,
    String description
) {

    public RouteLeg {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        Objects.requireNonNull(kind, "kind");
        if (distanceMiles < 0 || Double.isNaN(distanceMiles)) {
            throw new IllegalArgumentException("distanceMiles must be >= 0: " + distanceMiles);
        }
        if (durationHours < 0 || Double.isNaN(durationHours)) {
            throw new IllegalArgumentException("durationHours must be >= 0: " + durationHours);
        }
    }
}
