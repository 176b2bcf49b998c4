package com.eldplanner.model;

import com.eldplanner.routing.LegEstimate;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * Everything needed to plan and record one trip.
 *
 * {@code leg1} and {@code leg2} are optional caller-supplied routing figures;
 * when absent the configured route provider estimates the leg. A null
 * {@code startTime} means "now".
 */
public record TripRequest(
    Coordinate currentLocation,
    Coordinate pickupLocation,
    Coordinate dropoffLocation,
    LegEstimate leg1,
    LegEstimate leg2,
    TripOptions options,
    List<Map<String, Object>> dailyHoursHistory,
    DriverInfo driverInfo,
    LocalDateTime startTime
) {

    public TripRequest {
        dailyHoursHistory = dailyHoursHistory == null ? List.of() : dailyHoursHistory;
    }
}
