package com.eldplanner.unit;

import com.eldplanner.model.Coordinate;
import com.eldplanner.model.DutyEvent;
import com.eldplanner.model.LegKind;
import com.eldplanner.model.RestBreak;
import com.eldplanner.model.RestBreakKind;
import com.eldplanner.model.RouteLeg;
import com.eldplanner.model.TripOptions;
import com.eldplanner.model.WeeklyMode;
import com.eldplanner.service.ComplianceChecker;
import com.eldplanner.service.DutyScheduleSimulator;
import com.eldplanner.geo.NoOpLocationResolver;
import com.eldplanner.model.ComplianceReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Schedules produced with split sleeper, adverse conditions and the
 * short-haul exception switched on.
 */
@Tag("unit")
public class HosExceptionScheduleTest {

    private static final LocalDateTime START = LocalDateTime.of(2024, 1, 1, 6, 0);

    private DutyScheduleSimulator simulator;
    private ComplianceChecker checker;

    @BeforeEach
    void setUp() {
        simulator = new DutyScheduleSimulator(new NoOpLocationResolver());
        checker = new ComplianceChecker();
    }

    private static List<RouteLeg> legs() {
        Coordinate a = Coordinate.of(41.88, -87.63);
        Coordinate b = Coordinate.of(39.77, -86.16);
        Coordinate c = Coordinate.of(36.16, -86.78);
        return List.of(
            new RouteLeg(a, b, 400, 6.67, LegKind.TO_PICKUP, "Current Location to Pickup"),
            new RouteLeg(b, c, 600, 10.0, LegKind.TO_DROPOFF, "Pickup to Dropoff"));
    }

    private static int indexOf(List<DutyEvent> events, String activity) {
        for (int i = 0; i < events.size(); i++) {
            if (events.get(i).getActivity().equals(activity)) {
                return i;
            }
        }
        return -1;
    }

    @Test
    void test_split_sleeper_pairs_segments() {
        List<DutyEvent> events = simulator.simulate(legs(), START, TripOptions.standard(0).withSplitSleeper(true));

        List<DutyEvent> first = events.stream()
            .filter(e -> e.isRestBreakOf(RestBreakKind.SPLIT_SLEEPER_SEGMENT_1)).toList();
        List<DutyEvent> second = events.stream()
            .filter(e -> e.isRestBreakOf(RestBreakKind.SPLIT_SLEEPER_SEGMENT_2)).toList();
        assertEquals(1, first.size());
        assertEquals(1, second.size());
        assertEquals(7.0, first.get(0).getDurationHours(), 1e-9);
        assertEquals(3.0, second.get(0).getDurationHours(), 1e-9);

        RestBreak seg1 = first.get(0).getRestBreak().orElseThrow();
        RestBreak seg2 = second.get(0).getRestBreak().orElseThrow();
        assertEquals(seg2.segmentId(), seg1.pairedSegmentId());
        assertEquals(seg1.segmentId(), seg2.pairedSegmentId());
        assertTrue(seg1.excludedFromOnDutyWindow());
        assertFalse(seg2.excludedFromOnDutyWindow());
        assertFalse(events.stream().anyMatch(e -> e.getActivity().equals("10-Hour Rest Break")));
    }

    @Test
    void test_driving_between_split_segments_uses_remaining_window() {
        List<DutyEvent> events = simulator.simulate(legs(), START, TripOptions.standard(0).withSplitSleeper(true));

        int seg1 = indexOf(events, "Sleeper Berth (7-Hour Split)");
        DutyEvent between = events.get(seg1 + 1);
        assertEquals("Driving", between.getActivity());
        // 12.25h of the 14-hour window was used before segment 1
        assertEquals(105.0, between.getDistanceMiles().orElseThrow(), 1e-6);
        assertEquals("Sleeper Berth (3-Hour Split)", events.get(seg1 + 2).getActivity());
    }

    @Test
    void test_split_sleeper_schedule_has_no_closed_shift() {
        List<DutyEvent> events = simulator.simulate(legs(), START, TripOptions.standard(0).withSplitSleeper(true));

        ComplianceReport report = checker.check(events);

        assertTrue(report.compliant());
        assertEquals(0, report.totalShifts());
    }

    @Test
    void test_adverse_conditions_extend_driving() {
        List<DutyEvent> events = simulator.simulate(legs(), START,
            TripOptions.standard(0).withAdverseConditions(true));

        int rest = indexOf(events, "10-Hour Rest Break");
        DutyEvent beforeRest = events.get(rest - 1);
        assertEquals("Driving", beforeRest.getActivity());
        assertEquals(285.0, beforeRest.getDistanceMiles().orElseThrow(), 1e-6);
    }

    @Test
    void test_adverse_schedule_reported_against_baseline_limits() {
        List<DutyEvent> events = simulator.simulate(legs(), START,
            TripOptions.standard(0).withAdverseConditions(true));

        ComplianceReport report = checker.check(events);

        assertFalse(report.compliant());
        assertEquals(List.of("Shift 1: Exceeded 11-hour driving limit"), report.violations());
    }

    @Test
    void test_short_haul_widens_window_after_enough_reporting_days() {
        TripOptions options = TripOptions.standard(0).withSplitSleeper(true).withAirMileException(true, 5);

        List<DutyEvent> events = simulator.simulate(legs(), START, options);

        int seg1 = indexOf(events, "Sleeper Berth (7-Hour Split)");
        assertEquals(225.0, events.get(seg1 + 1).getDistanceMiles().orElseThrow(), 1e-6);
    }

    @Test
    void test_short_haul_window_used_once_per_cycle() {
        Coordinate a = Coordinate.of(41.88, -87.63);
        Coordinate b = Coordinate.of(39.77, -86.16);
        Coordinate c = Coordinate.of(36.16, -86.78);
        List<RouteLeg> longHaul = List.of(
            new RouteLeg(a, b, 400, 400 / 60.0, LegKind.TO_PICKUP, "Current Location to Pickup"),
            new RouteLeg(b, c, 2000, 2000 / 60.0, LegKind.TO_DROPOFF, "Pickup to Dropoff"));
        TripOptions options = TripOptions.standard(0).withSplitSleeper(true).withAirMileException(true, 5);

        List<DutyEvent> events = simulator.simulate(longHaul, START, options);

        int firstSeg1 = indexOf(events, "Sleeper Berth (7-Hour Split)");
        int secondSeg1 = -1;
        for (int i = firstSeg1 + 1; i < events.size(); i++) {
            if (events.get(i).getActivity().equals("Sleeper Berth (7-Hour Split)")) {
                secondSeg1 = i;
                break;
            }
        }
        assertTrue(secondSeg1 > firstSeg1, "expected a second split sleeper pair");
        // First shift drives into the 16-hour window; the next one is back to 14 hours.
        assertEquals(225.0, events.get(firstSeg1 + 1).getDistanceMiles().orElseThrow(), 1e-6);
        assertEquals(150.0, events.get(secondSeg1 + 1).getDistanceMiles().orElseThrow(), 1e-6);
    }

    @Test
    void test_short_haul_not_applied_with_too_few_reporting_days() {
        TripOptions options = TripOptions.standard(0).withSplitSleeper(true).withAirMileException(true, 4);

        List<DutyEvent> events = simulator.simulate(legs(), START, options);

        int seg1 = indexOf(events, "Sleeper Berth (7-Hour Split)");
        assertEquals(105.0, events.get(seg1 + 1).getDistanceMiles().orElseThrow(), 1e-6);
    }

    @Test
    void test_sixty_seven_mode_restarts_sooner() {
        TripOptions seventy = TripOptions.standard(40);
        TripOptions sixty = TripOptions.standard(40).withWeeklyMode(WeeklyMode.SIXTY_SEVEN);

        List<DutyEvent> withSeventy = simulator.simulate(legs(), START, seventy);
        List<DutyEvent> withSixty = simulator.simulate(legs(), START, sixty);

        assertEquals(-1, indexOf(withSeventy, "34-Hour Restart"));
        assertTrue(indexOf(withSixty, "34-Hour Restart") >= 0);
    }

    @Test
    void test_exceptions_do_not_restore_cycle_hours() {
        // Identical driving; only the standard plan gets ten hours back per rest.
        List<DutyEvent> standard = simulator.simulate(threeShiftLegs(), START, TripOptions.standard(35));
        List<DutyEvent> airMile = simulator.simulate(threeShiftLegs(), START,
            TripOptions.standard(35).withAirMileException(true, 0));

        assertEquals(0, count(standard, "34-Hour Restart"));
        assertEquals(2, count(standard, "10-Hour Rest Break"));
        assertEquals(1, count(airMile, "10-Hour Rest Break"));
        assertEquals(1, count(airMile, "34-Hour Restart"));
    }

    private static long count(List<DutyEvent> events, String activity) {
        return events.stream().filter(e -> e.getActivity().equals(activity)).count();
    }

    private static List<RouteLeg> threeShiftLegs() {
        Coordinate a = Coordinate.of(34.05, -118.24);
        Coordinate b = Coordinate.of(39.74, -104.99);
        Coordinate c = Coordinate.of(41.88, -87.63);
        return List.of(
            new RouteLeg(a, b, 660, 11.0, LegKind.TO_PICKUP, "Current Location to Pickup"),
            new RouteLeg(b, c, 1000, 16.7, LegKind.TO_DROPOFF, "Pickup to Dropoff"));
    }
}
