package com.eldplanner.model;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One calendar day of the duty timeline.
 *
 * Events are attributed to the day they start on, including events that run
 * past midnight.
 */
public class DailyLog {

    private final LocalDate date;
    private final List<DutyEvent> activities = new ArrayList<>();
    private double totalDriving;
    private double totalOnDutyNotDriving;
    private double totalOffDuty;
    private double totalSleeper;
    private double totalMiles;

    public DailyLog(LocalDate date) {
        this.date = date;
    }

    /**
     * Appends an event and adds its duration to the matching status total.
     */
    public void add(DutyEvent event) {
        activities.add(event);
        double hours = event.getDurationHours();
        switch (event.getDutyStatus()) {
            case DRIVING -> {
                totalDriving += hours;
                totalMiles += event.getDistanceMiles().orElse(0.0);
            }
            case ON_DUTY_NOT_DRIVING -> totalOnDutyNotDriving += hours;
            case OFF_DUTY -> totalOffDuty += hours;
            case SLEEPER_BERTH -> totalSleeper += hours;
        }
    }

    public LocalDate getDate() { return date; }
    public List<DutyEvent> getActivities() { return Collections.unmodifiableList(activities); }
    public double getTotalDriving() { return totalDriving; }
    public double getTotalOnDutyNotDriving() { return totalOnDutyNotDriving; }
    public double getTotalOffDuty() { return totalOffDuty; }
    public double getTotalSleeper() { return totalSleeper; }
    public double getTotalMiles() { return totalMiles; }

    /**
     * Driving plus on-duty-not-driving hours, the figure printed on a paper log.
     */
    public double getTotalOnDuty() {
        return totalDriving + totalOnDutyNotDriving;
    }

    public double getTotalHours() {
        return totalDriving + totalOnDutyNotDriving + totalOffDuty + totalSleeper;
    }
}
