package com.eldplanner.service;

import com.eldplanner.exception.InsufficientInputException;
import com.eldplanner.model.Coordinate;
import com.eldplanner.model.LegKind;
import com.eldplanner.model.RouteLeg;
import com.eldplanner.routing.LegEstimate;
import com.eldplanner.routing.RouteData;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns routing output and the three trip waypoints into typed legs.
 */
@Component
public class RouteLegBuilder {

    public List<RouteLeg> build(Coordinate current, Coordinate pickup, Coordinate dropoff, RouteData routeData) {
        if (current == null || pickup == null || dropoff == null) {
            throw new InsufficientInputException("current, pickup and dropoff locations are all required");
        }
        if (routeData == null) {
            throw new InsufficientInputException("route data is required");
        }

        List<RouteLeg> legs = new ArrayList<>(2);
        if (routeData.firstLeg().isPresent()) {
            LegEstimate leg1 = routeData.firstLeg().get();
            legs.add(new RouteLeg(current, pickup, leg1.distanceMiles(), leg1.durationHours(),
                LegKind.TO_PICKUP, "Current Location to Pickup"));
        }
        if (routeData.secondLeg().isPresent()) {
            LegEstimate leg2 = routeData.secondLeg().get();
            legs.add(new RouteLeg(pickup, dropoff, leg2.distanceMiles(), leg2.durationHours(),
                LegKind.TO_DROPOFF, "Pickup to Dropoff"));
        }
        return legs;
    }
}
