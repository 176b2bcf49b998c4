package com.eldplanner.model;

import java.time.LocalDateTime;

/**
 * Headline figures of a planned trip, hour totals rounded to a tenth.
 */
public record TripSummary(
    LocalDateTime startTime,
    LocalDateTime endTime,
    double totalDurationHours,
    double totalDrivingHours,
    double totalOnDutyHours,
    double totalRestHours,
    int numberOfStops,
    int restBreaks
) {
}
