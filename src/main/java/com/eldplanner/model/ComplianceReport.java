package com.eldplanner.model;

import java.util.List;

/**
 * Outcome of auditing a timeline against the baseline HOS limits.
 */
public record ComplianceReport(boolean compliant, List<String> violations, int totalShifts) {

    public ComplianceReport {
        violations = List.copyOf(violations);
    }
}
