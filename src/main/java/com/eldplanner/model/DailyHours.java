package com.eldplanner.model;

import java.time.LocalDate;
import java.util.Objects;

/**
 * On-duty hours recorded for one past day.
 */
public record DailyHours(LocalDate date, double onDutyHours) {

    public DailyHours {
        Objects.requireNonNull(date, "date");
        if (onDutyHours < 0 || onDutyHours > 24 || Double.isNaN(onDutyHours)) {
            throw new IllegalArgumentException("onDutyHours must be within [0, 24]: " + onDutyHours);
        }
    }
}
