package com.eldplanner.service;

import com.eldplanner.config.PlannerProperties;
import com.eldplanner.exception.InsufficientInputException;
import com.eldplanner.exception.TripNotFoundException;
import com.eldplanner.model.ComplianceReport;
import com.eldplanner.model.Coordinate;
import com.eldplanner.model.DailyLog;
import com.eldplanner.model.DutyEvent;
import com.eldplanner.model.DutyStatus;
import com.eldplanner.model.RollingHoursSummary;
import com.eldplanner.model.RouteLeg;
import com.eldplanner.model.TripOptions;
import com.eldplanner.model.TripPlan;
import com.eldplanner.model.TripRecord;
import com.eldplanner.model.TripRequest;
import com.eldplanner.model.TripSummary;
import com.eldplanner.model.WeeklyMode;
import com.eldplanner.repository.TripRepository;
import com.eldplanner.routing.LegEstimate;
import com.eldplanner.routing.RouteData;
import com.eldplanner.routing.RouteProvider;
import com.eldplanner.util.MdcPropagator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Entry point for trip planning.
 *
 * Combines routing, leg building, schedule simulation, daily log aggregation
 * and the compliance audit into a {@link TripPlan}, and keeps the result in
 * the trip repository.
 */
@Service
public class TripPlanService {

    private static final Logger log = LoggerFactory.getLogger(TripPlanService.class);

    private final RouteProvider routeProvider;
    private final RouteLegBuilder legBuilder;
    private final DutyScheduleSimulator simulator;
    private final DailyLogAggregator logAggregator;
    private final ComplianceChecker complianceChecker;
    private final RollingHoursTracker rollingHoursTracker;
    private final HoursHistoryParser historyParser;
    private final TripRepository tripRepository;
    private final PlannerProperties properties;
    private final Clock clock;

    public TripPlanService(RouteProvider routeProvider, RouteLegBuilder legBuilder,
                           DutyScheduleSimulator simulator, DailyLogAggregator logAggregator,
                           ComplianceChecker complianceChecker, RollingHoursTracker rollingHoursTracker,
                           HoursHistoryParser historyParser, TripRepository tripRepository,
                           PlannerProperties properties, Clock clock) {
        this.routeProvider = routeProvider;
        this.legBuilder = legBuilder;
        this.simulator = simulator;
        this.logAggregator = logAggregator;
        this.complianceChecker = complianceChecker;
        this.rollingHoursTracker = rollingHoursTracker;
        this.historyParser = historyParser;
        this.tripRepository = tripRepository;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Plans a trip, attaches the rolling-hours view of any supplied history and
     * stores the result.
     */
    public TripRecord planTrip(TripRequest request) {
        String tripId = UUID.randomUUID().toString();
        MDC.put(MdcPropagator.TRIP_ID_KEY, tripId);
        try {
            RouteData routeData = resolveRoute(request);
            LocalDateTime start = request.startTime() != null ? request.startTime() : LocalDateTime.now(clock);

            TripPlan plan = calculateTripPlan(request.currentLocation(), request.pickupLocation(),
                request.dropoffLocation(), routeData, request.options(), start);

            if (!request.dailyHoursHistory().isEmpty()) {
                plan = plan.withRollingHours(
                    rollingHours(request.dailyHoursHistory(), request.options().weeklyMode()));
            }

            TripRecord record = tripRepository.save(new TripRecord(tripId, LocalDateTime.now(clock),
                request.currentLocation(), request.pickupLocation(), request.dropoffLocation(),
                request.options().currentCycleUsed(), request.driverInfo(), routeData, plan));

            log.info("Planned trip: miles={}, elapsedHours={}, compliant={}, fallbackRoute={}",
                round1(plan.getTotalDistanceMiles()), round1(plan.getTotalElapsedHours()),
                plan.getHosCompliance().compliant(), routeData.fallback());
            return record;
        } finally {
            MDC.remove(MdcPropagator.TRIP_ID_KEY);
        }
    }

    /**
     * Builds the HOS-compliant plan for a current → pickup → dropoff trip.
     *
     * @throws InsufficientInputException if waypoints or both legs are missing
     */
    public TripPlan calculateTripPlan(Coordinate current, Coordinate pickup, Coordinate dropoff,
                                      RouteData routeData, TripOptions options, LocalDateTime startTime) {
        List<RouteLeg> legs = legBuilder.build(current, pickup, dropoff, routeData);
        List<DutyEvent> schedule = simulator.simulate(legs, startTime, options);
        List<DailyLog> dailyLogs = logAggregator.aggregate(schedule);
        ComplianceReport compliance = complianceChecker.check(schedule);

        double totalDistance = legs.stream().mapToDouble(RouteLeg::distanceMiles).sum();
        double nominalDriving = legs.stream().mapToDouble(RouteLeg::durationHours).sum();
        double elapsed = schedule.get(schedule.size() - 1).getEndOffsetHours();

        return new TripPlan(totalDistance, nominalDriving, elapsed, schedule, dailyLogs,
            compliance, summarize(schedule, startTime), null);
    }

    public RollingHoursSummary rollingHours(List<Map<String, Object>> history, WeeklyMode mode) {
        return rollingHoursTracker.rollingHours(historyParser.parse(history), mode);
    }

    public TripRecord findTrip(String tripId) {
        return tripRepository.findById(tripId)
            .orElseThrow(() -> new TripNotFoundException(tripId));
    }

    public List<TripRecord> listTrips() {
        return tripRepository.findRecent(properties.getTripListLimit());
    }

    public WeeklyMode defaultWeeklyMode() {
        return WeeklyMode.fromLabel(properties.getDefaultWeeklyMode());
    }

    private RouteData resolveRoute(TripRequest request) {
        if (request.currentLocation() == null || request.pickupLocation() == null
                || request.dropoffLocation() == null) {
            throw new InsufficientInputException("current, pickup and dropoff locations are all required");
        }
        boolean estimated = request.leg1() == null || request.leg2() == null;
        LegEstimate leg1 = request.leg1() != null
            ? request.leg1()
            : routeProvider.estimate(request.currentLocation(), request.pickupLocation());
        LegEstimate leg2 = request.leg2() != null
            ? request.leg2()
            : routeProvider.estimate(request.pickupLocation(), request.dropoffLocation());
        return new RouteData(leg1, leg2, estimated && routeProvider.isFallback());
    }

    private static TripSummary summarize(List<DutyEvent> schedule, LocalDateTime startTime) {
        double driving = 0;
        double onDuty = 0;
        double rest = 0;
        int stops = 0;
        int restBreaks = 0;
        for (DutyEvent event : schedule) {
            DutyStatus status = event.getDutyStatus();
            if (status == DutyStatus.DRIVING) {
                driving += event.getDurationHours();
            }
            if (status.isOnDuty()) {
                onDuty += event.getDurationHours();
            } else {
                rest += event.getDurationHours();
            }
            if (DutyScheduleSimulator.FUELING.equals(event.getActivity())
                    || DutyScheduleSimulator.BREAK.equals(event.getActivity())) {
                stops++;
            }
            if (event.getRestBreak().isPresent()) {
                restBreaks++;
            }
        }
        DutyEvent last = schedule.get(schedule.size() - 1);
        return new TripSummary(startTime, last.getEndTime(), round1(last.getEndOffsetHours()),
            round1(driving), round1(onDuty), round1(rest), stops, restBreaks);
    }

    static double round1(double value) {
        return BigDecimal.valueOf(value).setScale(1, RoundingMode.HALF_UP).doubleValue();
    }
}
