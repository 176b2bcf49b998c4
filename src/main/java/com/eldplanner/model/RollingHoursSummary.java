package com.eldplanner.model;

import java.util.List;

/**
 * On-duty hours used and still available over the trailing cycle window.
 */
public record RollingHoursSummary(
    double hoursUsed,
    double hoursAvailable,
    WeeklyMode weeklyMode,
    List<DailyHours> days
) {

    public RollingHoursSummary {
        days = List.copyOf(days);
    }
}
