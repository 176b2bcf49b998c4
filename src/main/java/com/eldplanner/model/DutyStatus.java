package com.eldplanner.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Regulatory duty status of a logged interval.
 */
public enum DutyStatus {
    OFF_DUTY("off_duty"),
    SLEEPER_BERTH("sleeper_berth"),
    DRIVING("driving"),
    ON_DUTY_NOT_DRIVING("on_duty_not_driving");

    private final String code;

    DutyStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * Returns true if time in this status counts against the on-duty window.
     */
    public boolean isOnDuty() {
        return this == DRIVING || this == ON_DUTY_NOT_DRIVING;
    }

    /**
     * Returns true if this status is a rest status (off duty or sleeper berth).
     */
    public boolean isRest() {
        return this == OFF_DUTY || this == SLEEPER_BERTH;
    }
}
