package com.eldplanner.unit;

import com.eldplanner.exception.InsufficientInputException;
import com.eldplanner.model.Coordinate;
import com.eldplanner.model.LegKind;
import com.eldplanner.model.RouteLeg;
import com.eldplanner.routing.LegEstimate;
import com.eldplanner.routing.RouteData;
import com.eldplanner.service.RouteLegBuilder;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class RouteLegBuilderTest {

    private final RouteLegBuilder builder = new RouteLegBuilder();

    private final Coordinate current = Coordinate.of(32.7767, -96.7970);
    private final Coordinate pickup = Coordinate.of(29.7604, -95.3698);
    private final Coordinate dropoff = Coordinate.of(30.2672, -97.7431);

    @Test
    void test_builds_both_legs() {
        RouteData data = RouteData.of(new LegEstimate(240, 4), new LegEstimate(165, 2.75));

        List<RouteLeg> legs = builder.build(current, pickup, dropoff, data);

        assertEquals(2, legs.size());
        RouteLeg first = legs.get(0);
        assertEquals(LegKind.TO_PICKUP, first.kind());
        assertEquals(current, first.start());
        assertEquals(pickup, first.end());
        assertEquals(240.0, first.distanceMiles(), 1e-9);
        assertEquals("Current Location to Pickup", first.description());

        RouteLeg second = legs.get(1);
        assertEquals(LegKind.TO_DROPOFF, second.kind());
        assertEquals(pickup, second.start());
        assertEquals(dropoff, second.end());
        assertEquals(2.75, second.durationHours(), 1e-9);
        assertEquals("Pickup to Dropoff", second.description());
    }

    @Test
    void test_missing_leg_is_left_out() {
        RouteData data = new RouteData(new LegEstimate(240, 4), null, false);

        List<RouteLeg> legs = builder.build(current, pickup, dropoff, data);

        assertEquals(1, legs.size());
        assertEquals(LegKind.TO_PICKUP, legs.get(0).kind());
    }

    @Test
    void test_missing_waypoint_rejected() {
        RouteData data = RouteData.of(new LegEstimate(240, 4), new LegEstimate(165, 2.75));

        assertThrows(InsufficientInputException.class, () -> builder.build(current, null, dropoff, data));
        assertThrows(InsufficientInputException.class, () -> builder.build(current, pickup, dropoff, null));
    }
}
