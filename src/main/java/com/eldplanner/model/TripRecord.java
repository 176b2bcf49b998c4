package com.eldplanner.model;

import com.eldplanner.routing.RouteData;

import java.time.LocalDateTime;

/**
 * A planned trip as kept by the trip repository.
 */
public record TripRecord(
    String id,
    LocalDateTime createdAt,
    Coordinate currentLocation,
    Coordinate pickupLocation,
    Coordinate dropoffLocation,
    double currentCycleUsed,
    DriverInfo driverInfo,
    RouteData routeData,
    TripPlan tripPlan
) {
}
