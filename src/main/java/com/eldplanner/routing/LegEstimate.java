package com.eldplanner.routing;

/**
 * Distance and nominal drive time of one leg as reported by a routing source.
 */
public record LegEstimate(double distanceMiles, double durationHours) {

    public LegEstimate {
        if (distanceMiles < 0 || Double.isNaN(distanceMiles)) {
            throw new IllegalArgumentException("distanceMiles must be >= 0: " + distanceMiles);
        }
        if (durationHours < 0 || Double.isNaN(durationHours)) {
            throw new IllegalArgumentException("durationHours must be >= 0: " + durationHours);
        }
    }
}
