package com.eldplanner.model;

import com.eldplanner.exception.InvalidInputException;

import java.util.Objects;

/**
 * Driver cycle state and regulatory-exception switches for one plan.
 *
 * @param currentCycleUsed      on-duty hours already used in the current cycle
 * @param weeklyMode            70/8 or 60/7 cycle
 * @param useSplitSleeper       take required rest as a 7h + 3h sleeper-berth split
 * @param adverseConditions     extend the driving ceiling by two hours
 * @param airMileException      allow the 16-hour short-haul on-duty window
 * @param reportingLocationDays consecutive days the driver has reported to the
 *                              work-reporting location before this trip
 */
public record TripOptions(
    double currentCycleUsed,
    WeeklyMode weeklyMode,
    boolean useSplitSleeper,
    boolean adverseConditions,
    boolean airMileException,
    int reportingLocationDays
) {

    public TripOptions {
        Objects.requireNonNull(weeklyMode, "weeklyMode");
        if (currentCycleUsed < 0 || Double.isNaN(currentCycleUsed)) {
            throw new InvalidInputException("currentCycleUsed must be >= 0: " + currentCycleUsed);
        }
        if (reportingLocationDays < 0) {
            throw new InvalidInputException("reportingLocationDays must be >= 0: " + reportingLocationDays);
        }
    }

    public static TripOptions standard(double currentCycleUsed) {
        return new TripOptions(currentCycleUsed, WeeklyMode.SEVENTY_EIGHT, false, false, false, 0);
    }

    public boolean anyExceptionActive() {
        return useSplitSleeper || adverseConditions || airMileException;
    }

    public TripOptions withSplitSleeper(boolean enabled) {
        return new TripOptions(currentCycleUsed, weeklyMode, enabled, adverseConditions,
            airMileException, reportingLocationDays);
    }

    public TripOptions withAdverseConditions(boolean enabled) {
        return new TripOptions(currentCycleUsed, weeklyMode, useSplitSleeper, enabled,
            airMileException, reportingLocationDays);
    }

    public TripOptions withAirMileException(boolean enabled, int days) {
        return new TripOptions(currentCycleUsed, weeklyMode, useSplitSleeper, adverseConditions,
            enabled, days);
    }

    public TripOptions withWeeklyMode(WeeklyMode mode) {
        return new TripOptions(currentCycleUsed, mode, useSplitSleeper, adverseConditions,
            airMileException, reportingLocationDays);
    }
}
