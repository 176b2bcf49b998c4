package com.eldplanner.controller;

import com.eldplanner.controller.dto.LegDto;
import com.eldplanner.controller.dto.TripPlanRequest;
import com.eldplanner.model.DriverInfo;
import com.eldplanner.model.RollingHoursSummary;
import com.eldplanner.model.TripOptions;
import com.eldplanner.model.TripRecord;
import com.eldplanner.model.TripRequest;
import com.eldplanner.model.WeeklyMode;
import com.eldplanner.routing.LegEstimate;
import com.eldplanner.service.TripPlanService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST endpoints for trip planning, stored trips and rolling cycle hours.
 */
@RestController
@RequestMapping("/api/trips")
public class TripController {

    private static final Logger log = LoggerFactory.getLogger(TripController.class);

    private final TripPlanService tripPlanService;

    public TripController(TripPlanService tripPlanService) {
        this.tripPlanService = tripPlanService;
    }

    @PostMapping("/plan")
    public ResponseEntity<TripRecord> plan(@Valid @RequestBody TripPlanRequest request) {
        WeeklyMode mode = request.getWeeklyMode() == null
            ? tripPlanService.defaultWeeklyMode()
            : WeeklyMode.fromLabel(request.getWeeklyMode());
        TripOptions options = new TripOptions(request.getCurrentCycleUsed(), mode,
            request.isUseSplitSleeper(), request.isUseAdverseConditions(),
            request.isUseAirMileException(), request.getReportingLocationDays());
        DriverInfo driverInfo = new DriverInfo(request.getDriverName(), request.getCarrierName(),
            request.getMainOffice(), request.getVehicleNumber());

        log.debug("Trip plan request: cycleUsed={}, mode={}, split={}, adverse={}, airMile={}",
            options.currentCycleUsed(), mode.getLabel(), options.useSplitSleeper(),
            options.adverseConditions(), options.airMileException());

        TripRecord record = tripPlanService.planTrip(new TripRequest(
            request.getCurrentLocation().toCoordinate(),
            request.getPickupLocation().toCoordinate(),
            request.getDropoffLocation().toCoordinate(),
            toEstimate(request.getLeg1()),
            toEstimate(request.getLeg2()),
            options,
            request.getDailyHoursHistory(),
            driverInfo,
            request.getStartTime()));
        return ResponseEntity.ok(record);
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of("status", "UP", "service", "eld-planner"));
    }

    @GetMapping("/{tripId}")
    public ResponseEntity<TripRecord> getTrip(@PathVariable String tripId) {
        return ResponseEntity.ok(tripPlanService.findTrip(tripId));
    }

    @GetMapping
    public ResponseEntity<Map<String, List<TripRecord>>> listTrips() {
        return ResponseEntity.ok(Map.of("trips", tripPlanService.listTrips()));
    }

    @PostMapping("/rolling-hours")
    public ResponseEntity<RollingHoursSummary> rollingHours(
            @RequestParam(name = "weekly_mode", defaultValue = "70/8") String weeklyMode,
            @RequestBody List<Map<String, Object>> history) {
        return ResponseEntity.ok(tripPlanService.rollingHours(history, WeeklyMode.fromLabel(weeklyMode)));
    }

    private static LegEstimate toEstimate(LegDto leg) {
        return leg == null ? null : leg.toEstimate();
    }
}
