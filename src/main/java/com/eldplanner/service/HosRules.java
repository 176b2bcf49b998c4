package com.eldplanner.service;

/**
 * FMCSA hours-of-service limits for property-carrying drivers, plus the
 * operational constants the planner assumes. All values are hours unless the
 * name says otherwise.
 */
public final class HosRules {

    public static final double MAX_DRIVING_HOURS = 11.0;
    public static final double ADVERSE_CONDITIONS_EXTENSION = 2.0;
    public static final double MAX_ON_DUTY_HOURS = 14.0;
    public static final double SHORT_HAUL_ON_DUTY_HOURS = 16.0;
    public static final double MIN_OFF_DUTY_HOURS = 10.0;
    public static final double BREAK_REQUIRED_AFTER_HOURS = 8.0;
    public static final double MIN_BREAK_HOURS = 0.5;
    public static final double RESTART_HOURS = 34.0;

    // 7 + 3 is the only split the simulator takes.
    public static final double SPLIT_FIRST_SEGMENT_HOURS = 7.0;
    public static final double SPLIT_SECOND_SEGMENT_HOURS = 3.0;

    public static final int SHORT_HAUL_MIN_REPORTING_DAYS = 5;
    public static final int SHORT_HAUL_CYCLE_DAYS = 7;

    public static final double AVERAGE_SPEED_MPH = 60.0;
    public static final double FUELING_INTERVAL_MILES = 1000.0;
    public static final double FUELING_HOURS = 0.5;
    public static final double PICKUP_DROPOFF_HOURS = 1.0;
    public static final double INSPECTION_HOURS = 0.25;

    private HosRules() {
        // Constants holder - prevent instantiation
    }
}
