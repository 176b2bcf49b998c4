package com.eldplanner.controller.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Body of {@code POST /api/trips/plan}.
 */
public class TripPlanRequest {

    @NotNull(message = "Current location is required")
    @Valid
    private LocationDto currentLocation;

    @NotNull(message = "Pickup location is required")
    @Valid
    private LocationDto pickupLocation;

    @NotNull(message = "Dropoff location is required")
    @Valid
    private LocationDto dropoffLocation;

    @Valid
    private LegDto leg1;

    @Valid
    private LegDto leg2;

    @DecimalMin(value = "0.0", message = "Cycle hours used cannot be negative")
    @DecimalMax(value = "70.0", message = "Cycle hours used cannot exceed 70")
    private double currentCycleUsed = 0.0;

    @Pattern(regexp = "70/8|60/7", message = "Weekly mode must be 70/8 or 60/7")
    private String weeklyMode;

    private boolean useSplitSleeper;
    private boolean useAdverseConditions;
    private boolean useAirMileException;

    @Min(value = 0, message = "Reporting days cannot be negative")
    private int reportingLocationDays;

    private List<Map<String, Object>> dailyHoursHistory = new ArrayList<>();

    private LocalDateTime startTime;

    @Size(max = 100)
    private String driverName = "John Doe";

    @Size(max = 200)
    private String carrierName = "Example Carrier Inc.";

    @Size(max = 200)
    private String mainOffice = "123 Main St, City, ST";

    @Size(max = 50)
    private String vehicleNumber = "TRUCK-001";

    public LocationDto getCurrentLocation() { return currentLocation; }
    public void setCurrentLocation(LocationDto currentLocation) { this.currentLocation = currentLocation; }
    public LocationDto getPickupLocation() { return pickupLocation; }
    public void setPickupLocation(LocationDto pickupLocation) { this.pickupLocation = pickupLocation; }
    public LocationDto getDropoffLocation() { return dropoffLocation; }
    public void setDropoffLocation(LocationDto dropoffLocation) { this.dropoffLocation = dropoffLocation; }
    public LegDto getLeg1() { return leg1; }
    public void setLeg1(LegDto leg1) { this.leg1 = leg1; }
    public LegDto getLeg2() { return leg2; }
    public void setLeg2(LegDto leg2) { this.leg2 = leg2; }
    public double getCurrentCycleUsed() { return currentCycleUsed; }
    public void setCurrentCycleUsed(double currentCycleUsed) { this.currentCycleUsed = currentCycleUsed; }
    public String getWeeklyMode() { return weeklyMode; }
    public void setWeeklyMode(String weeklyMode) { this.weeklyMode = weeklyMode; }
    public boolean isUseSplitSleeper() { return useSplitSleeper; }
    public void setUseSplitSleeper(boolean useSplitSleeper) { this.useSplitSleeper = useSplitSleeper; }
    public boolean isUseAdverseConditions() { return useAdverseConditions; }
    public void setUseAdverseConditions(boolean useAdverseConditions) { this.useAdverseConditions = useAdverseConditions; }
    public boolean isUseAirMileException() { return useAirMileException; }
    public void setUseAirMileException(boolean useAirMileException) { this.useAirMileException = useAirMileException; }
    public int getReportingLocationDays() { return reportingLocationDays; }
    public void setReportingLocationDays(int reportingLocationDays) { this.reportingLocationDays = reportingLocationDays; }
    public List<Map<String, Object>> getDailyHoursHistory() { return dailyHoursHistory; }
    public void setDailyHoursHistory(List<Map<String, Object>> history) { this.dailyHoursHistory = history; }
    public LocalDateTime getStartTime() { return startTime; }
    public void setStartTime(LocalDateTime startTime) { this.startTime = startTime; }
    public String getDriverName() { return driverName; }
    public void setDriverName(String driverName) { this.driverName = driverName; }
    public String getCarrierName() { return carrierName; }
    public void setCarrierName(String carrierName) { this.carrierName = carrierName; }
    public String getMainOffice() { return mainOffice; }
    public void setMainOffice(String mainOffice) { this.mainOffice = mainOffice; }
    public String getVehicleNumber() { return vehicleNumber; }
    public void setVehicleNumber(String vehicleNumber) { this.vehicleNumber = vehicleNumber; }
}
