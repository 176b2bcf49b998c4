package com.eldplanner.service;

import com.eldplanner.model.ComplianceReport;
import com.eldplanner.model.DutyEvent;
import com.eldplanner.model.DutyStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

import static com.eldplanner.service.HosRules.MAX_DRIVING_HOURS;
import static com.eldplanner.service.HosRules.MAX_ON_DUTY_HOURS;
import static com.eldplanner.service.HosRules.MIN_OFF_DUTY_HOURS;

/**
 * Audits a timeline against the baseline 11-hour driving and 14-hour on-duty
 * limits.
 *
 * Shifts are re-derived from the events alone: on-duty time accumulates until
 * an off-duty or sleeper-berth period of at least ten hours closes the shift.
 * Exceptions are deliberately not re-applied, so a timeline that relied on
 * adverse conditions or split sleeper is reported against the plain limits.
 * A shift still open when the timeline ends is not counted.
 */
@Component
public class ComplianceChecker {

    private static final Logger log = LoggerFactory.getLogger(ComplianceChecker.class);

    public ComplianceReport check(List<DutyEvent> events) {
        List<Shift> shifts = new ArrayList<>();
        Shift current = new Shift();

        for (DutyEvent event : events) {
            DutyStatus status = event.getDutyStatus();
            if (status.isOnDuty()) {
                current.started = true;
                current.onDuty += event.getDurationHours();
                if (status == DutyStatus.DRIVING) {
                    current.driving += event.getDurationHours();
                }
            } else if (status.isRest() && event.getDurationHours() >= MIN_OFF_DUTY_HOURS) {
                if (current.started) {
                    shifts.add(current);
                }
                current = new Shift();
            }
        }

        List<String> violations = new ArrayList<>();
        for (int i = 0; i < shifts.size(); i++) {
            Shift shift = shifts.get(i);
            if (shift.driving > MAX_DRIVING_HOURS + SimulationState.EPSILON) {
                violations.add("Shift " + (i + 1) + ": Exceeded 11-hour driving limit");
            }
            if (shift.onDuty > MAX_ON_DUTY_HOURS + SimulationState.EPSILON) {
                violations.add("Shift " + (i + 1) + ": Exceeded 14-hour on-duty limit");
            }
        }

        if (!violations.isEmpty()) {
            log.warn("HOS audit found {} violation(s) across {} shift(s)", violations.size(), shifts.size());
        }
        return new ComplianceReport(violations.isEmpty(), violations, shifts.size());
    }

    private static final class Shift {
        boolean started;
        double driving;
        double onDuty;
    }
}
