package com.eldplanner.routing;

import java.util.Optional;

/**
 * Per-leg routing results for a current → pickup → dropoff trip.
 *
 * Either leg may be absent; {@code fallback} records that the figures came from
 * straight-line estimation rather than a road network.
 */
public record RouteData(LegEstimate leg1, LegEstimate leg2, boolean fallback) {

    public static RouteData of(LegEstimate leg1, LegEstimate leg2) {
        return new RouteData(leg1, leg2, false);
    }

    public Optional<LegEstimate> firstLeg() {
        return Optional.ofNullable(leg1);
    }

    public Optional<LegEstimate> secondLeg() {
        return Optional.ofNullable(leg2);
    }
}
