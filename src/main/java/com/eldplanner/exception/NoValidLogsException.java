package com.eldplanner.exception;

/**
 * None of the supplied history records could be parsed.
 */
public class NoValidLogsException extends PlannerException {

    private final int rejectedRecords;

    public NoValidLogsException(int rejectedRecords) {
        super("No valid logs: all " + rejectedRecords + " history records were malformed");
        this.rejectedRecords = rejectedRecords;
    }

    public int getRejectedRecords() {
        return rejectedRecords;
    }
}
