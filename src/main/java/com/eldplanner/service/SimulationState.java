package com.eldplanner.service;

import com.eldplanner.model.Coordinate;
import com.eldplanner.model.TripOptions;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Counters owned by a single schedule simulation.
 *
 * Created fresh for every call to {@link DutyScheduleSimulator#simulate} and
 * discarded afterwards; never shared between plans.
 */
final class SimulationState {

    static final double EPSILON = 1e-6;

    LocalDateTime currentTime;
    double shiftDriving;
    double shiftOnDuty;
    double continuousDriving;
    double distanceCovered;
    double remainingWeeklyHours;
    final double weeklyMax;

    int pendingSegmentIndex = -1;
    String pendingSegmentId;
    private int segmentCounter;

    Coordinate workReportingLocation;
    int shortHaulUses;
    LocalDateTime cycleAnchor;
    LocalDateTime lastFullRestart;

    final boolean adverseConditions;
    final boolean airMileException;

    SimulationState(LocalDateTime startTime, TripOptions options) {
        this.currentTime = startTime;
        this.cycleAnchor = startTime;
        this.weeklyMax = options.weeklyMode().getMaxHours();
        this.remainingWeeklyHours = clampWeekly(weeklyMax - options.currentCycleUsed());
        this.adverseConditions = options.adverseConditions();
        this.airMileException = options.airMileException();
    }

    void advance(double hours) {
        currentTime = currentTime.plusNanos(Math.round(hours * 3_600_000_000_000.0));
    }

    void chargeWeekly(double hours) {
        remainingWeeklyHours = clampWeekly(remainingWeeklyHours - hours);
    }

    void restoreWeekly(double hours) {
        remainingWeeklyHours = clampWeekly(remainingWeeklyHours + hours);
    }

    boolean weeklyExhausted() {
        return remainingWeeklyHours <= EPSILON;
    }

    void resetShift() {
        shiftDriving = 0;
        shiftOnDuty = 0;
    }

    boolean hasPendingSegment() {
        return pendingSegmentIndex >= 0;
    }

    String nextSegmentId() {
        return "SB-" + (++segmentCounter);
    }

    double milesUntilFuel() {
        double interval = HosRules.FUELING_INTERVAL_MILES;
        double nextBoundary = (Math.floor((distanceCovered + EPSILON) / interval) + 1) * interval;
        return nextBoundary - distanceCovered;
    }

    /**
     * Starts a new short-haul cycle once seven days have passed since the last one began.
     */
    void rollShortHaulCycle() {
        if (!Duration.between(cycleAnchor, currentTime).minusDays(HosRules.SHORT_HAUL_CYCLE_DAYS).isNegative()) {
            shortHaulUses = 0;
            cycleAnchor = currentTime;
        }
    }

    private double clampWeekly(double hours) {
        return Math.max(0.0, Math.min(weeklyMax, hours));
    }
}
