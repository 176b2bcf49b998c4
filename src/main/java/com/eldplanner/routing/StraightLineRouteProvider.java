package com.eldplanner.routing;

import com.eldplanner.model.Coordinate;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Great-circle distance estimate used when no road routing is available.
 *
 * Distances are rounded to a tenth of a mile and durations to a hundredth of
 * an hour, assuming a constant average speed.
 */
public class StraightLineRouteProvider implements RouteProvider {

    static final double EARTH_RADIUS_MILES = 3959.0;

    private final double averageSpeedMph;

    public StraightLineRouteProvider(double averageSpeedMph) {
        if (averageSpeedMph <= 0) {
            throw new IllegalArgumentException("averageSpeedMph must be positive: " + averageSpeedMph);
        }
        this.averageSpeedMph = averageSpeedMph;
    }

    @Override
    public LegEstimate estimate(Coordinate from, Coordinate to) {
        double miles = haversineMiles(from, to);
        return new LegEstimate(round(miles, 1), round(miles / averageSpeedMph, 2));
    }

    @Override
    public boolean isFallback() {
        return true;
    }

    public double haversineMiles(Coordinate from, Coordinate to) {
        double dLat = Math.toRadians(to.lat() - from.lat());
        double dLon = Math.toRadians(to.lon() - from.lon());
        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2) +
                   Math.cos(Math.toRadians(from.lat())) * Math.cos(Math.toRadians(to.lat())) *
                   Math.sin(dLon / 2) * Math.sin(dLon / 2);
        double c = 2 * Math.asin(Math.sqrt(a));
        return EARTH_RADIUS_MILES * c;
    }

    private static double round(double value, int scale) {
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }
}
