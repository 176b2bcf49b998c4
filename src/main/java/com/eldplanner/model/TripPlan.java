package com.eldplanner.model;

import java.util.List;
import java.util.Optional;

/**
 * Complete result of planning one trip: the duty timeline and every view
 * derived from it.
 */
public class TripPlan {

    private final double totalDistanceMiles;
    private final double totalDrivingHours;
    private final double totalElapsedHours;
    private final List<DutyEvent> schedule;
    private final List<DailyLog> dailyLogs;
    private final ComplianceReport hosCompliance;
    private final TripSummary summary;
    private final RollingHoursSummary rollingHours;

    public TripPlan(double totalDistanceMiles, double totalDrivingHours, double totalElapsedHours,
                    List<DutyEvent> schedule, List<DailyLog> dailyLogs,
                    ComplianceReport hosCompliance, TripSummary summary,
                    RollingHoursSummary rollingHours) {
        this.totalDistanceMiles = totalDistanceMiles;
        this.totalDrivingHours = totalDrivingHours;
        this.totalElapsedHours = totalElapsedHours;
        this.schedule = List.copyOf(schedule);
        this.dailyLogs = List.copyOf(dailyLogs);
        this.hosCompliance = hosCompliance;
        this.summary = summary;
        this.rollingHours = rollingHours;
    }

    public double getTotalDistanceMiles() { return totalDistanceMiles; }

    /** Sum of the routing provider's nominal leg durations. */
    public double getTotalDrivingHours() { return totalDrivingHours; }

    /** End offset of the last timeline event. */
    public double getTotalElapsedHours() { return totalElapsedHours; }

    public List<DutyEvent> getSchedule() { return schedule; }
    public List<DailyLog> getDailyLogs() { return dailyLogs; }
    public ComplianceReport getHosCompliance() { return hosCompliance; }
    public TripSummary getSummary() { return summary; }

    public Optional<RollingHoursSummary> getRollingHours() {
        return Optional.ofNullable(rollingHours);
    }

    public TripPlan withRollingHours(RollingHoursSummary summary) {
        return new TripPlan(totalDistanceMiles, totalDrivingHours, totalElapsedHours,
            schedule, dailyLogs, hosCompliance, this.summary, summary);
    }
}
