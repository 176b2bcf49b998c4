package com.eldplanner.geo;

import com.eldplanner.model.PlaceName;

/**
 * Resolver used when no geocoding backend is configured.
 */
public class NoOpLocationResolver implements LocationResolver {

    @Override
    public String resolve(double lat, double lon) {
        return PlaceName.UNKNOWN.toString();
    }
}
