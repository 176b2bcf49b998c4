package com.eldplanner.service;

import com.eldplanner.exception.InsufficientInputException;
import com.eldplanner.geo.LocationResolver;
import com.eldplanner.model.Coordinate;
import com.eldplanner.model.DutyEvent;
import com.eldplanner.model.DutyStatus;
import com.eldplanner.model.LegKind;
import com.eldplanner.model.PlaceName;
import com.eldplanner.model.RestBreak;
import com.eldplanner.model.RouteLeg;
import com.eldplanner.model.TripOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static com.eldplanner.service.HosRules.*;
import static com.eldplanner.service.SimulationState.EPSILON;

/**
 * Builds the minute-by-minute duty timeline for a trip.
 *
 * Each leg is driven in increments bounded by the 8-hour break rule, the shift
 * driving and on-duty ceilings, the weekly cycle budget and the next fueling
 * point. Whenever a ceiling is reached, exactly one rest strategy is chosen:
 * split sleeper segment 1, split sleeper segment 2, a 34-hour restart, or a
 * standard 10-hour rest, in that order of precedence.
 *
 * The simulator holds no per-plan state; each call owns a fresh
 * {@link SimulationState}, so concurrent calls are independent.
 */
@Service
public class DutyScheduleSimulator {

    private static final Logger log = LoggerFactory.getLogger(DutyScheduleSimulator.class);

    static final String PRE_TRIP = "Pre-Trip Inspection";
    static final String PICKUP = "Pickup";
    static final String DRIVING = "Driving";
    static final String BREAK = "30-Minute Break";
    static final String FUELING = "Fueling";
    static final String STANDARD_REST = "10-Hour Rest Break";
    static final String RESTART = "34-Hour Restart";
    static final String SPLIT_FIRST = "Sleeper Berth (7-Hour Split)";
    static final String SPLIT_SECOND = "Sleeper Berth (3-Hour Split)";
    static final String DROPOFF = "Dropoff";
    static final String POST_TRIP = "Post-Trip Inspection";

    private final LocationResolver locationResolver;

    public DutyScheduleSimulator(LocationResolver locationResolver) {
        this.locationResolver = Objects.requireNonNull(locationResolver, "locationResolver");
    }

    /**
     * Simulates the trip and returns its contiguous duty timeline.
     *
     * @param legs      ordered legs, at least one
     * @param startTime wall-clock start of the trip
     * @param options   cycle state and exception switches
     * @return events in time order with cumulative offsets assigned
     * @throws InsufficientInputException if no legs are given
     */
    public List<DutyEvent> simulate(List<RouteLeg> legs, LocalDateTime startTime, TripOptions options) {
        if (legs == null || legs.isEmpty()) {
            throw new InsufficientInputException("At least one route leg is required to build a schedule");
        }
        Objects.requireNonNull(startTime, "startTime");
        Objects.requireNonNull(options, "options");

        SimulationState state = new SimulationState(startTime, options);
        List<DutyEvent> events = new ArrayList<>();

        for (int i = 0; i < legs.size(); i++) {
            RouteLeg leg = legs.get(i);
            PlaceName startPlace = resolvePlace(leg.start());

            if (leg.kind() == LegKind.TO_PICKUP) {
                if (state.workReportingLocation == null) {
                    state.workReportingLocation = leg.start();
                }
                append(events, state, DutyEvent.builder(PRE_TRIP, DutyStatus.ON_DUTY_NOT_DRIVING)
                    .location(leg.start()).place(startPlace)
                    .description("Pre-trip vehicle inspection"), INSPECTION_HOURS);
                state.shiftOnDuty += INSPECTION_HOURS;
            } else if (leg.kind() == LegKind.TO_DROPOFF) {
                append(events, state, DutyEvent.builder(PICKUP, DutyStatus.ON_DUTY_NOT_DRIVING)
                    .location(leg.start()).place(startPlace)
                    .description("Loading at pickup location"), PICKUP_DROPOFF_HOURS);
                state.shiftOnDuty += PICKUP_DROPOFF_HOURS;
            }

            driveLeg(leg, startPlace, options, state, events);

            if (i == legs.size() - 1) {
                PlaceName endPlace = resolvePlace(leg.end());
                append(events, state, DutyEvent.builder(DROPOFF, DutyStatus.ON_DUTY_NOT_DRIVING)
                    .location(leg.end()).place(endPlace)
                    .description("Unloading at dropoff location"), PICKUP_DROPOFF_HOURS);
                append(events, state, DutyEvent.builder(POST_TRIP, DutyStatus.ON_DUTY_NOT_DRIVING)
                    .location(leg.end()).place(endPlace)
                    .description("Post-trip vehicle inspection"), INSPECTION_HOURS);
            }
        }

        List<DutyEvent> timeline = assignOffsets(events);
        log.info("Built duty timeline: legs={}, events={}, miles={}, remainingCycleHours={}, lastRestart={}",
            legs.size(), timeline.size(), String.format("%.1f", state.distanceCovered),
            String.format("%.2f", state.remainingWeeklyHours),
            state.lastFullRestart == null ? "none" : state.lastFullRestart);
        return timeline;
    }

    private void driveLeg(RouteLeg leg, PlaceName place, TripOptions options,
                          SimulationState state, List<DutyEvent> events) {
        double remainingMiles = leg.distanceMiles();

        while (remainingMiles > EPSILON) {
            if (state.continuousDriving >= BREAK_REQUIRED_AFTER_HOURS - EPSILON) {
                append(events, state, DutyEvent.builder(BREAK, DutyStatus.OFF_DUTY)
                    .location(leg.start()).place(place)
                    .description("Required 30-minute rest break"), MIN_BREAK_HOURS);
                state.continuousDriving = 0;
            }

            state.rollShortHaulCycle();
            boolean shortHaul = isShortHaulEligible(options, state);
            double onDutyCeiling = shortHaul ? SHORT_HAUL_ON_DUTY_HOURS : MAX_ON_DUTY_HOURS;
            double drivingCeiling = state.adverseConditions
                ? MAX_DRIVING_HOURS + ADVERSE_CONDITIONS_EXTENSION
                : MAX_DRIVING_HOURS;

            if (state.shiftDriving >= drivingCeiling - EPSILON
                    || state.shiftOnDuty >= onDutyCeiling - EPSILON
                    || state.weeklyExhausted()) {
                boolean shortHaulConsumed = shortHaul && state.shiftOnDuty >= onDutyCeiling - EPSILON;
                takeRest(leg, place, options, state, events);
                if (shortHaulConsumed) {
                    state.shortHaulUses++;
                    log.debug("16-hour short-haul exception used at {}", state.currentTime);
                }
                // Limits are re-evaluated after every rest; a split pair may need both segments.
                continue;
            }

            double hoursUntilBreak = BREAK_REQUIRED_AFTER_HOURS - state.continuousDriving;
            double hoursUntilShiftLimit = Math.min(
                drivingCeiling - state.shiftDriving,
                onDutyCeiling - state.shiftOnDuty);
            double drivableHours = Math.min(Math.min(hoursUntilBreak, hoursUntilShiftLimit),
                state.remainingWeeklyHours);

            double driveMiles = Math.min(remainingMiles,
                Math.min(drivableHours * AVERAGE_SPEED_MPH, state.milesUntilFuel()));
            if (remainingMiles - driveMiles < EPSILON) {
                driveMiles = remainingMiles;
            }
            assert driveMiles > 0 : "non-positive driving increment with " + remainingMiles + " miles left";
            double driveHours = driveMiles / AVERAGE_SPEED_MPH;

            append(events, state, DutyEvent.builder(DRIVING, DutyStatus.DRIVING)
                .distanceMiles(driveMiles)
                .location(leg.start()).place(place)
                .description("Driving - " + leg.description()), driveHours);

            double milesBefore = state.distanceCovered;
            state.shiftDriving += driveHours;
            state.shiftOnDuty += driveHours;
            state.continuousDriving += driveHours;
            state.distanceCovered += driveMiles;
            state.chargeWeekly(driveHours);
            remainingMiles -= driveMiles;

            if (crossesFuelingPoint(milesBefore, state.distanceCovered)) {
                append(events, state, DutyEvent.builder(FUELING, DutyStatus.ON_DUTY_NOT_DRIVING)
                    .location(leg.start()).place(place)
                    .description("Fueling stop"), FUELING_HOURS);
                state.shiftOnDuty += FUELING_HOURS;
                state.chargeWeekly(FUELING_HOURS);
            }
        }
    }

    private void takeRest(RouteLeg leg, PlaceName place, TripOptions options,
                          SimulationState state, List<DutyEvent> events) {
        Coordinate at = leg.start();

        if (!state.hasPendingSegment() && state.weeklyExhausted()) {
            // Only a restart recovers an exhausted cycle, split mode or not.
            takeRestart(at, place, state, events);
        } else if (options.useSplitSleeper() && !state.hasPendingSegment()) {
            String segmentId = state.nextSegmentId();
            append(events, state, DutyEvent.builder(SPLIT_FIRST, DutyStatus.SLEEPER_BERTH)
                .location(at).place(place)
                .restBreak(RestBreak.firstSegment(segmentId))
                .description("Split sleeper berth period, segment 1 of 2"), SPLIT_FIRST_SEGMENT_HOURS);
            state.pendingSegmentIndex = events.size() - 1;
            state.pendingSegmentId = segmentId;
            state.shiftDriving = 0;
            log.debug("Split sleeper segment {} started at {}", segmentId, at);
        } else if (state.hasPendingSegment()) {
            String segmentId = state.nextSegmentId();
            String firstId = state.pendingSegmentId;
            append(events, state, DutyEvent.builder(SPLIT_SECOND, DutyStatus.SLEEPER_BERTH)
                .location(at).place(place)
                .restBreak(RestBreak.secondSegment(segmentId, firstId))
                .description("Split sleeper berth period, segment 2 of 2"), SPLIT_SECOND_SEGMENT_HOURS);
            DutyEvent first = events.get(state.pendingSegmentIndex);
            RestBreak firstBreak = first.getRestBreak()
                .orElseThrow(() -> new IllegalStateException("pending segment without rest metadata"));
            events.set(state.pendingSegmentIndex, first.withRestBreak(firstBreak.pairedWith(segmentId)));
            state.pendingSegmentIndex = -1;
            state.pendingSegmentId = null;
            state.resetShift();
            log.debug("Split sleeper pair {}/{} completed", firstId, segmentId);
        } else if (state.remainingWeeklyHours < MAX_ON_DUTY_HOURS) {
            takeRestart(at, place, state, events);
        } else {
            append(events, state, DutyEvent.builder(STANDARD_REST, DutyStatus.SLEEPER_BERTH)
                .location(at).place(place)
                .restBreak(RestBreak.fullRest())
                .description("Mandatory 10-hour rest period"), MIN_OFF_DUTY_HOURS);
            state.resetShift();
            if (!options.anyExceptionActive()) {
                state.restoreWeekly(MIN_OFF_DUTY_HOURS);
            }
        }
    }

    private void takeRestart(Coordinate at, PlaceName place, SimulationState state, List<DutyEvent> events) {
        append(events, state, DutyEvent.builder(RESTART, DutyStatus.OFF_DUTY)
            .location(at).place(place)
            .restBreak(RestBreak.fullRestart())
            .description("34-hour restart of the weekly cycle"), RESTART_HOURS);
        state.resetShift();
        state.remainingWeeklyHours = state.weeklyMax;
        state.lastFullRestart = state.currentTime;
        state.shortHaulUses = 0;
        state.cycleAnchor = state.currentTime;
        log.debug("34-hour restart completed at {}", state.currentTime);
    }

    private boolean isShortHaulEligible(TripOptions options, SimulationState state) {
        return state.airMileException
            && state.workReportingLocation != null
            && options.reportingLocationDays() >= SHORT_HAUL_MIN_REPORTING_DAYS
            && state.shortHaulUses == 0;
    }

    private static boolean crossesFuelingPoint(double milesBefore, double milesAfter) {
        double interval = FUELING_INTERVAL_MILES;
        return Math.floor((milesAfter + EPSILON) / interval) > Math.floor((milesBefore + EPSILON) / interval);
    }

    private PlaceName resolvePlace(Coordinate coordinate) {
        try {
            return PlaceName.parse(locationResolver.resolve(coordinate.lat(), coordinate.lon()));
        } catch (RuntimeException e) {
            log.warn("Could not resolve place for {}, using unknown: {}", coordinate, e.getMessage());
            return PlaceName.UNKNOWN;
        }
    }

    private static void append(List<DutyEvent> events, SimulationState state,
                               DutyEvent.Builder builder, double hours) {
        events.add(builder.startTime(state.currentTime).durationHours(hours).build());
        state.advance(hours);
    }

    private static List<DutyEvent> assignOffsets(List<DutyEvent> events) {
        List<DutyEvent> timeline = new ArrayList<>(events.size());
        double cumulative = 0;
        for (DutyEvent event : events) {
            double end = cumulative + event.getDurationHours();
            timeline.add(event.withOffsets(cumulative, end));
            cumulative = end;
        }
        return timeline;
    }
}
